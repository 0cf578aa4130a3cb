package com.example.enrollment.application.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.enrollment.application.event.PaymentReconciliationEvent;
import com.example.enrollment.entity.MaskedPaymentDetails;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentMethod;
import com.example.enrollment.entity.PaymentTransaction;
import com.example.enrollment.entity.TransactionStatus;
import com.example.enrollment.entity.TransactionType;
import com.example.enrollment.repository.PaymentRepository;
import com.example.enrollment.repository.PaymentTransactionRepository;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiExecutorService;
import com.example.enrollment.web.external.SlackApiClient;
import com.example.enrollment.web.external.dto.PgCancelRequest;
import com.example.enrollment.web.external.dto.PgCancelResponse;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class PaymentReconciliationServiceTest {

	@Mock
	private PaymentRepository paymentRepository;

	@Mock
	private PaymentTransactionRepository paymentTransactionRepository;

	@Mock
	private PgApiClient pgApiClient;

	@Mock
	private PgApiExecutorService pgApiExecutorService;

	@Mock
	private SlackApiClient slackApiClient;

	@InjectMocks
	private PaymentReconciliationService reconciliationService;

	private final String reason = "Test failure reason";
	private PaymentReconciliationEvent event;
	private Payment payment;

	@BeforeEach
	void setUp() {
		payment = Payment.create("enr-1", 1L, PaymentMethod.CREDIT_CARD, new BigDecimal("100.00"), "VND",
			MaskedPaymentDetails.builder().build());
		ReflectionTestUtils.setField(payment, "id", "pay-1");
		payment.markCompleted("txn_1", "{}", "card-pg", LocalDateTime.now());
		event = new PaymentReconciliationEvent(this, "pay-1", "enr-1", reason);
	}

	@SuppressWarnings("unchecked")
	private void givenExecutorRunsCall() throws Exception {
		when(pgApiExecutorService.execute(eq("cancel"), any(Callable.class)))
			.thenAnswer(invocation -> ((Callable<Object>) invocation.getArgument(1)).call());
	}

	// ================================
	// refundCancelledEnrollmentPayment 테스트
	// ================================

	// 성공 케이스: PG 취소 후 REFUND SUCCEEDED 원장 기록
	@Test
	void refund_success() throws Exception {
		givenExecutorRunsCall();
		when(paymentRepository.findById("pay-1")).thenReturn(Optional.of(payment));
		PgCancelResponse response = new PgCancelResponse();
		response.setSuccess(true);
		response.setCancelTransactionId("cxl_txn_1");
		when(pgApiClient.cancel(any(PgCancelRequest.class))).thenReturn(response);

		reconciliationService.refundCancelledEnrollmentPayment(event);

		ArgumentCaptor<PgCancelRequest> requestCaptor = ArgumentCaptor.forClass(PgCancelRequest.class);
		verify(pgApiClient).cancel(requestCaptor.capture());
		assertEquals("txn_1", requestCaptor.getValue().getTransactionId());

		ArgumentCaptor<PaymentTransaction> captor = ArgumentCaptor.forClass(PaymentTransaction.class);
		verify(paymentTransactionRepository).save(captor.capture());
		assertEquals(TransactionType.REFUND, captor.getValue().getType());
		assertEquals(TransactionStatus.SUCCEEDED, captor.getValue().getStatus());
		assertEquals("cxl_txn_1", captor.getValue().getExternalTransactionId());
	}

	// 이미 환불된 결제는 PG를 다시 호출하지 않음
	@Test
	void refund_alreadyRefunded() {
		when(paymentRepository.findById("pay-1")).thenReturn(Optional.of(payment));
		when(paymentTransactionRepository.existsByPaymentIdAndTypeAndStatus("pay-1", TransactionType.REFUND,
			TransactionStatus.SUCCEEDED)).thenReturn(true);

		reconciliationService.refundCancelledEnrollmentPayment(event);

		verify(pgApiClient, never()).cancel(any());
		verify(paymentTransactionRepository, never()).save(any());
	}

	// 실패 케이스: PG가 취소를 거절하면 예외 (재시도 대상)
	@Test
	void refund_rejected_throws() throws Exception {
		givenExecutorRunsCall();
		when(paymentRepository.findById("pay-1")).thenReturn(Optional.of(payment));
		PgCancelResponse response = new PgCancelResponse();
		response.setSuccess(false);
		response.setMessage("already settled");
		when(pgApiClient.cancel(any(PgCancelRequest.class))).thenReturn(response);

		IllegalStateException ex = assertThrows(IllegalStateException.class,
			() -> reconciliationService.refundCancelledEnrollmentPayment(event));

		assertThat(ex.getMessage()).contains("already settled");
		verify(paymentTransactionRepository, never()).save(any());
	}

	// ================================
	// recoverRefund 테스트
	// ================================

	@Test
	void recover_recordsFailedRefundAndAlerts() {
		when(paymentRepository.findById("pay-1")).thenReturn(Optional.of(payment));

		reconciliationService.recoverRefund(new RuntimeException("PG down"), event);

		ArgumentCaptor<PaymentTransaction> captor = ArgumentCaptor.forClass(PaymentTransaction.class);
		verify(paymentTransactionRepository).save(captor.capture());
		assertEquals(TransactionType.REFUND, captor.getValue().getType());
		assertEquals(TransactionStatus.FAILED, captor.getValue().getStatus());
		verify(slackApiClient).sendSlackAlert(anyString());
	}
}
