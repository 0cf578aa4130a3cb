package com.example.enrollment.application.service;

import com.example.enrollment.application.event.PaymentReconciliationEvent;
import com.example.enrollment.config.EnrollmentProperties;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentStatus;
import com.example.enrollment.repository.PaymentRepository;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiExecutorService;
import com.example.enrollment.web.external.dto.PgPaymentHistory;
import com.example.enrollment.web.external.gateway.ChargeResult;
import com.example.enrollment.web.external.gateway.PaymentGatewayRegistry;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * PG 승인(2단계)과 결과 반영(3단계) 사이에서 중단되어 PENDING으로 남은 결제를 PG 결제내역 기준으로 마무리합니다.
 * 응답 시간 초과로 FAILED 처리한 결제도 PG 결제내역을 확인해, 뒤늦게 승인된 건은 환불합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentAdjustmentService implements CommandLineRunner {

	private final PaymentRepository paymentRepository;
	private final PaymentService paymentService;
	private final PgApiClient pgApiClient;
	private final PgApiExecutorService pgApiExecutorService;
	private final PaymentGatewayRegistry paymentGatewayRegistry;
	private final EnrollmentProperties enrollmentProperties;
	private final ApplicationEventPublisher eventPublisher;

	/**
	 * 스케줄러: 기본 5분마다 오래된 PENDING 결제와 미확인 타임아웃 결제를 보정합니다.
	 */
	@Scheduled(fixedDelayString = "${enrollment.payment.adjustment-delay-ms:300000}",
		initialDelayString = "${enrollment.payment.adjustment-initial-delay-ms:300000}")
	public void adjustPendingPayments() {
		LocalDateTime threshold = LocalDateTime.now().minus(enrollmentProperties.getPayment().getAdjustmentThreshold());
		List<Payment> pendingPayments = paymentRepository.findByStatusAndCreatedAtBefore(PaymentStatus.PENDING, threshold);

		for (Payment payment : pendingPayments) {
			try {
				adjust(payment);
			} catch (Exception e) {
				log.error("Error adjusting payment id: {}", payment.getId(), e);
			}
		}

		List<Payment> timedOutPayments = paymentRepository.findByStatusAndErrorCodeAndGatewayCheckedAtIsNullAndCreatedAtBefore(
			PaymentStatus.FAILED, Payment.GATEWAY_TIMEOUT, threshold);
		for (Payment payment : timedOutPayments) {
			try {
				verifyTimedOut(payment);
			} catch (Exception e) {
				log.error("Error verifying timed-out payment id: {}", payment.getId(), e);
			}
		}
	}

	/**
	 * 시스템 시작 시 미완료 결제가 있는 경우 즉시 보정 작업 수행
	 */
	@Override
	public void run(String... args) {
		if (enrollmentProperties.getPayment().isAdjustOnStartup()) {
			adjustPendingPayments();
		}
	}

	void adjust(Payment payment) {
		PgPaymentHistory history = pgApiExecutorService.execute("history",
			() -> pgApiClient.findPaymentHistory(payment.getId()));
		String gatewayName = paymentGatewayRegistry.get(payment.getPaymentMethod()).getName();

		if (!history.isFound()) {
			paymentService.cancelUnsubmittedPayment(payment.getId());
			log.info("Payment adjusted to CANCELLED (never reached PG): paymentId={}", payment.getId());
			return;
		}

		ChargeResult result = history.isApproved()
			? ChargeResult.success(history.getTransactionId(), history.getRawResponse(), gatewayName)
			: ChargeResult.failure(history.getErrorCode(), history.getMessage(), history.getRawResponse(), gatewayName);
		PaymentOutcome outcome = paymentService.completePayment(payment.getId(), result);
		if (outcome.isReconciliationRequired()) {
			eventPublisher.publishEvent(new PaymentReconciliationEvent(this, payment.getId(), payment.getEnrollmentId(),
				"결제 보정: 수강 신청 취소 후 결제 승인"));
		}
		log.info("Payment adjusted to {}: paymentId={}", outcome.getPayment().getStatus(), payment.getId());
	}

	void verifyTimedOut(Payment payment) {
		PgPaymentHistory history = pgApiExecutorService.execute("history",
			() -> pgApiClient.findPaymentHistory(payment.getId()));

		if (history.isFound() && history.isApproved()) {
			if (paymentService.recordLateApproval(payment.getId(), history.getTransactionId(), history.getRawResponse())) {
				eventPublisher.publishEvent(new PaymentReconciliationEvent(this, payment.getId(),
					payment.getEnrollmentId(), "결제 보정: 응답 시간 초과 후 승인된 결제"));
			}
			return;
		}
		paymentService.markGatewayChecked(payment.getId());
		log.info("Timed-out payment verified as not approved: paymentId={}", payment.getId());
	}
}
