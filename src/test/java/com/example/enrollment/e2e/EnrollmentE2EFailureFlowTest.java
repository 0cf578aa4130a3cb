package com.example.enrollment.e2e;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.enrollment.application.service.ActivationRetryScheduler;
import com.example.enrollment.application.service.EnrollmentService;
import com.example.enrollment.application.service.PaymentAdjustmentService;
import com.example.enrollment.entity.Course;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentStatus;
import com.example.enrollment.entity.PaymentTransaction;
import com.example.enrollment.entity.Student;
import com.example.enrollment.entity.TransactionStatus;
import com.example.enrollment.entity.TransactionType;
import com.example.enrollment.repository.CourseRepository;
import com.example.enrollment.repository.EnrollmentRepository;
import com.example.enrollment.repository.PaymentRepository;
import com.example.enrollment.repository.PaymentTransactionRepository;
import com.example.enrollment.repository.StudentRepository;
import com.example.enrollment.web.controller.dto.EnrollmentRequest;
import com.example.enrollment.web.controller.dto.PaymentRequest;
import com.example.enrollment.web.external.CourseProvisioningClient;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiException;
import com.example.enrollment.web.external.SlackApiClient;
import com.example.enrollment.web.external.dto.PgApproveResponse;
import com.example.enrollment.web.external.dto.PgCancelRequest;
import com.example.enrollment.web.external.dto.PgCancelResponse;
import com.example.enrollment.web.external.dto.PgPaymentHistory;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

/**
 * 외부 연동(PG, LMS)을 목으로 대체해 실패/경합 시나리오를 검증합니다.
 */
@SpringBootTest
@AutoConfigureMockMvc
class EnrollmentE2EFailureFlowTest {

	@Autowired
	private MockMvc mockMvc;

	@Autowired
	private ObjectMapper objectMapper;

	@Autowired
	private JdbcTemplate jdbcTemplate;

	@Autowired
	private EnrollmentRepository enrollmentRepository;

	@Autowired
	private PaymentRepository paymentRepository;

	@Autowired
	private PaymentTransactionRepository paymentTransactionRepository;

	@Autowired
	private CourseRepository courseRepository;

	@Autowired
	private StudentRepository studentRepository;

	@Autowired
	private EnrollmentService enrollmentService;

	@Autowired
	private ActivationRetryScheduler activationRetryScheduler;

	@Autowired
	private PaymentAdjustmentService paymentAdjustmentService;

	@MockBean
	private PgApiClient pgApiClient;

	@MockBean
	private CourseProvisioningClient courseProvisioningClient;

	@SpyBean
	private SlackApiClient slackApiClient;

	private final Long courseId = 1L;
	private final Long userId = 1L;

	@BeforeEach
	void setUp() {
		paymentTransactionRepository.deleteAll();
		paymentRepository.deleteAll();
		enrollmentRepository.deleteAll();

		if (!courseRepository.existsById(courseId)) {
			courseRepository.save(Course.of(courseId, "Spring Boot in Practice", new BigDecimal("500000"), 20));
			studentRepository.save(Student.of(userId, "jane@example.com"));
		}
	}

	// ===== 수강 신청 경합 =====

	/**
	 * [시나리오 1] 같은 사용자가 같은 강의를 동시에 신청
	 * 유니크 제약으로 정확히 한 건만 생성되어야 합니다.
	 */
	@Test
	void concurrentDuplicateRegistration_onlyOneSucceeds() throws Exception {
		int threadCount = 5;
		ExecutorService executorService = Executors.newFixedThreadPool(threadCount);
		CountDownLatch ready = new CountDownLatch(1);
		CountDownLatch done = new CountDownLatch(threadCount);
		AtomicInteger successCount = new AtomicInteger();
		AtomicInteger failureCount = new AtomicInteger();

		for (int i = 0; i < threadCount; i++) {
			executorService.submit(() -> {
				try {
					ready.await();
					enrollmentService.register(userId, enrollmentRequest());
					successCount.incrementAndGet();
				} catch (Exception e) {
					failureCount.incrementAndGet();
				} finally {
					done.countDown();
				}
			});
		}
		ready.countDown();
		assertThat(done.await(30, TimeUnit.SECONDS)).isTrue();
		executorService.shutdown();

		assertThat(successCount.get()).isEqualTo(1);
		assertThat(failureCount.get()).isEqualTo(threadCount - 1);
		assertThat(enrollmentRepository.findAll()).hasSize(1);
	}

	// ===== 활성화 실패 =====

	/**
	 * [시나리오 2] LMS 프로비저닝 3회 연속 실패
	 * 마지막 시도 후 재시도가 불가능해지고 운영 알림이 전송되어야 합니다.
	 */
	@Test
	void activationFailsThreeTimes_exhausted() throws Exception {
		String enrollmentId = paidEnrollmentId();
		when(courseProvisioningClient.provision(any())).thenReturn(false);

		mockMvc.perform(post("/enrollments/{id}/activate", enrollmentId))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.granted").value(false))
			.andExpect(jsonPath("$.accessGranted").value(true))
			.andExpect(jsonPath("$.retryAvailable").value(true))
			.andExpect(jsonPath("$.activationAttempts").value(1));

		mockMvc.perform(post("/enrollments/{id}/activate", enrollmentId))
			.andExpect(jsonPath("$.retryAvailable").value(true))
			.andExpect(jsonPath("$.activationAttempts").value(2));

		mockMvc.perform(post("/enrollments/{id}/activate", enrollmentId))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.granted").value(false))
			.andExpect(jsonPath("$.retryAvailable").value(false))
			.andExpect(jsonPath("$.activationAttempts").value(3));

		mockMvc.perform(post("/enrollments/{id}/activate/retry", enrollmentId))
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.code").value("NO_RETRIES_AVAILABLE"));

		Enrollment enrollment = enrollmentRepository.findById(enrollmentId).orElseThrow();
		assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.ACTIVATING);
		assertThat(enrollment.getActivationAttempts()).isEqualTo(3);
		assertThat(enrollment.getNextRetryAt()).isNull();
		// 접근 권한은 유지
		assertThat(enrollment.isAccessGranted()).isTrue();

		await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
			verify(slackApiClient, times(1)).sendSlackAlert(any()));
	}

	/**
	 * [시나리오 3] 첫 시도 실패 후 재시도 시각이 도래하면 스케줄러가 다시 활성화합니다.
	 */
	@Test
	void activationRetriedByScheduler() throws Exception {
		String enrollmentId = paidEnrollmentId();
		when(courseProvisioningClient.provision(any())).thenReturn(false, true);

		mockMvc.perform(post("/enrollments/{id}/activate", enrollmentId))
			.andExpect(jsonPath("$.retryAvailable").value(true));

		// 아직 재시도 시각 전
		activationRetryScheduler.retryDueActivations();
		assertThat(enrollmentRepository.findById(enrollmentId).orElseThrow().getStatus())
			.isEqualTo(EnrollmentStatus.ACTIVATING);

		jdbcTemplate.update("UPDATE enrollments SET next_retry_at = ? WHERE id = ?",
			Timestamp.valueOf(LocalDateTime.now().minusSeconds(1)), enrollmentId);
		activationRetryScheduler.retryDueActivations();

		Enrollment enrollment = enrollmentRepository.findById(enrollmentId).orElseThrow();
		assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.ACTIVE);
		assertThat(enrollment.getActivationAttempts()).isEqualTo(1);
		assertThat(enrollment.getNextRetryAt()).isNull();
	}

	// ===== 결제 중 취소 =====

	/**
	 * [시나리오 4] PG 승인 대기 중 수강 신청이 취소됨
	 * 승인은 결제에 기록되고, 수강 신청은 CANCELLED로 유지되며, 비동기로 PG 취소(환불)가 이루어져야 합니다.
	 * 응답은 성공이 아닌 ENROLLMENT_CANCELLED(409)와 환불 진행 여부입니다.
	 */
	@Test
	void cancelledDuringApproval_refunded() throws Exception {
		String enrollmentId = enrollmentService.register(userId, enrollmentRequest()).getEnrollment().getId();
		when(pgApiClient.approve(any())).thenAnswer(invocation -> {
			enrollmentService.cancel(enrollmentId);
			return PgApproveResponse.approved("txn_midflight", "{\"status\":\"approved\"}");
		});
		PgCancelResponse cancelResponse = new PgCancelResponse();
		cancelResponse.setSuccess(true);
		cancelResponse.setCancelTransactionId("cxl_txn_midflight");
		when(pgApiClient.cancel(any())).thenReturn(cancelResponse);

		pay(enrollmentId)
			.andExpect(status().isConflict())
			.andExpect(jsonPath("$.code").value("ENROLLMENT_CANCELLED"))
			.andExpect(jsonPath("$.details.refundPending").value(true))
			.andExpect(jsonPath("$.details.paymentId").exists());

		Payment payment = paymentRepository.findByEnrollmentIdOrderByCreatedAtDesc(enrollmentId).get(0);
		assertThat(payment.getStatus()).isEqualTo(PaymentStatus.COMPLETED);
		assertThat(enrollmentRepository.findById(enrollmentId).orElseThrow().getStatus())
			.isEqualTo(EnrollmentStatus.CANCELLED);

		await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
			List<PaymentTransaction> transactions =
				paymentTransactionRepository.findByPaymentIdOrderByCreatedAtAsc(payment.getId());
			assertThat(transactions).extracting(PaymentTransaction::getType)
				.containsExactly(TransactionType.CHARGE, TransactionType.REFUND);
			assertThat(transactions.get(1).getStatus()).isEqualTo(TransactionStatus.SUCCEEDED);
			assertThat(transactions.get(1).getExternalTransactionId()).isEqualTo("cxl_txn_midflight");
		});
	}

	/**
	 * [시나리오 5] 환불이 계속 거절되면 3회 재시도 후 실패 기록과 알림을 남깁니다.
	 */
	@Test
	void refundRejected_recoveredAfterRetries() throws Exception {
		String enrollmentId = enrollmentService.register(userId, enrollmentRequest()).getEnrollment().getId();
		when(pgApiClient.approve(any())).thenAnswer(invocation -> {
			enrollmentService.cancel(enrollmentId);
			return PgApproveResponse.approved("txn_rejected", "{}");
		});
		PgCancelResponse rejected = new PgCancelResponse();
		rejected.setSuccess(false);
		rejected.setMessage("Already settled");
		when(pgApiClient.cancel(any())).thenReturn(rejected);

		pay(enrollmentId).andExpect(status().isConflict());
		Payment payment = paymentRepository.findByEnrollmentIdOrderByCreatedAtDesc(enrollmentId).get(0);

		await().atMost(20, TimeUnit.SECONDS).untilAsserted(() -> {
			List<PaymentTransaction> transactions =
				paymentTransactionRepository.findByPaymentIdOrderByCreatedAtAsc(payment.getId());
			assertThat(transactions).extracting(PaymentTransaction::getStatus)
				.containsExactly(TransactionStatus.SUCCEEDED, TransactionStatus.FAILED);
		});
		verify(pgApiClient, times(3)).cancel(any());
		await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
			verify(slackApiClient, times(1)).sendSlackAlert(any()));
	}

	// ===== PG 장애 =====

	/**
	 * [시나리오 6] PG 응답 지연 (테스트 설정 타임아웃 2초)
	 * 결제는 FAILED(GATEWAY_TIMEOUT)로 기록되고 수강 신청은 재결제 가능한 상태로 남아야 합니다.
	 */
	@Test
	void gatewayTimeout_paymentFailed() throws Exception {
		String enrollmentId = enrollmentService.register(userId, enrollmentRequest()).getEnrollment().getId();
		when(pgApiClient.approve(any())).thenAnswer(invocation -> {
			Thread.sleep(5_000);
			return PgApproveResponse.approved("txn_late", "{}");
		});

		pay(enrollmentId)
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.code").value("PAYMENT_FAILED"))
			.andExpect(jsonPath("$.errorCode").value(PgApiException.GATEWAY_TIMEOUT));

		Enrollment enrollment = enrollmentRepository.findById(enrollmentId).orElseThrow();
		assertThat(enrollment.getStatus()).isEqualTo(EnrollmentStatus.PAYMENT_PENDING);
		assertThat(enrollment.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
		verify(pgApiClient, never()).cancel(any());
	}

	/**
	 * [시나리오 7] PG가 클라이언트 타임아웃 이후에도 처리를 계속해 결국 승인함
	 * 확인 전까지 재결제는 막히고, 결제 보정이 뒤늦은 승인을 찾아 환불한 뒤에만 다시 결제할 수 있습니다.
	 * 최종적으로 사용자에게 남는 출금은 1건이어야 합니다.
	 */
	@Test
	void approvedAfterTimeout_refundedBeforeRetry() throws Exception {
		String enrollmentId = enrollmentService.register(userId, enrollmentRequest()).getEnrollment().getId();
		AtomicInteger approveCalls = new AtomicInteger();
		CountDownLatch lateApproved = new CountDownLatch(1);
		when(pgApiClient.approve(any())).thenAnswer(invocation -> {
			if (approveCalls.incrementAndGet() == 1) {
				sleepIgnoringInterrupt(3_000);
				lateApproved.countDown();
				return PgApproveResponse.approved("txn_late", "{\"status\":\"approved\"}");
			}
			return PgApproveResponse.approved("txn_retry", "{\"status\":\"approved\"}");
		});
		PgPaymentHistory approvedAtPg = new PgPaymentHistory();
		approvedAtPg.setFound(true);
		approvedAtPg.setApproved(true);
		approvedAtPg.setTransactionId("txn_late");
		approvedAtPg.setRawResponse("{\"status\":\"approved\"}");
		when(pgApiClient.findPaymentHistory(any())).thenReturn(approvedAtPg);
		PgCancelResponse cancelResponse = new PgCancelResponse();
		cancelResponse.setSuccess(true);
		cancelResponse.setCancelTransactionId("cxl_txn_late");
		when(pgApiClient.cancel(any())).thenReturn(cancelResponse);

		pay(enrollmentId)
			.andExpect(status().isBadRequest())
			.andExpect(jsonPath("$.errorCode").value(PgApiException.GATEWAY_TIMEOUT));

		// 승인 여부 확인 전 재결제 차단
		pay(enrollmentId)
			.andExpect(status().isConflict())
			.andExpect(jsonPath("$.code").value("PAYMENT_VERIFICATION_PENDING"));
		assertThat(approveCalls.get()).isEqualTo(1);

		assertThat(lateApproved.await(10, TimeUnit.SECONDS)).isTrue();
		Payment timedOut = paymentRepository.findByEnrollmentIdOrderByCreatedAtDesc(enrollmentId).get(0);
		jdbcTemplate.update("UPDATE payments SET created_at = ? WHERE id = ?",
			Timestamp.valueOf(LocalDateTime.now().minusMinutes(10)), timedOut.getId());
		paymentAdjustmentService.adjustPendingPayments();

		await().atMost(10, TimeUnit.SECONDS).untilAsserted(() -> {
			List<PaymentTransaction> transactions =
				paymentTransactionRepository.findByPaymentIdOrderByCreatedAtAsc(timedOut.getId());
			assertThat(transactions).extracting(PaymentTransaction::getType)
				.containsExactly(TransactionType.CHARGE, TransactionType.REFUND);
			assertThat(transactions.get(1).getStatus()).isEqualTo(TransactionStatus.SUCCEEDED);
		});
		Payment verified = paymentRepository.findById(timedOut.getId()).orElseThrow();
		assertThat(verified.getStatus()).isEqualTo(PaymentStatus.FAILED);
		assertThat(verified.getTransactionId()).isEqualTo("txn_late");
		assertThat(verified.getGatewayCheckedAt()).isNotNull();

		pay(enrollmentId)
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("ENROLLED"));

		ArgumentCaptor<PgCancelRequest> cancelled = ArgumentCaptor.forClass(PgCancelRequest.class);
		verify(pgApiClient, times(1)).cancel(cancelled.capture());
		assertThat(cancelled.getValue().getTransactionId()).isEqualTo("txn_late");
		assertThat(approveCalls.get()).isEqualTo(2);
	}

	// 원격 PG는 클라이언트가 연결을 끊어도 처리를 계속함
	private void sleepIgnoringInterrupt(long millis) {
		long deadline = System.currentTimeMillis() + millis;
		long remaining;
		while ((remaining = deadline - System.currentTimeMillis()) > 0) {
			try {
				Thread.sleep(remaining);
			} catch (InterruptedException ignored) {
				// 계속 대기
			}
		}
	}

	private String paidEnrollmentId() throws Exception {
		String enrollmentId = enrollmentService.register(userId, enrollmentRequest()).getEnrollment().getId();
		when(pgApiClient.approve(any())).thenReturn(PgApproveResponse.approved("txn_paid", "{}"));
		pay(enrollmentId)
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("ENROLLED"));
		return enrollmentId;
	}

	private ResultActions pay(String enrollmentId) throws Exception {
		PaymentRequest request = new PaymentRequest();
		request.setPaymentMethod("credit_card");
		request.setPaymentDetails(Map.of(
			"cardNumber", "4111111111111111",
			"cardExpiry", "12/28",
			"cardCvv", "123",
			"cardHolderName", "Jane Doe"));
		return mockMvc.perform(post("/enrollments/{id}/payments", enrollmentId)
			.contentType(MediaType.APPLICATION_JSON)
			.content(objectMapper.writeValueAsString(request)));
	}

	private EnrollmentRequest enrollmentRequest() {
		EnrollmentRequest request = new EnrollmentRequest();
		request.setCourseId(courseId);
		request.setFullName("Jane Doe");
		request.setEmail("jane@example.com");
		return request;
	}
}
