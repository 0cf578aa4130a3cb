package com.example.enrollment.application.service;

import com.example.enrollment.application.event.PaymentReconciliationEvent;
import com.example.enrollment.entity.Payment;
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
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

/**
 * 취소된 수강 신청에 대해 승인된 결제를 PG에 취소 요청합니다.
 * Payment는 COMPLETED 그대로 두고 결과는 transactions 원장에 REFUND로 남깁니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentReconciliationService {

	private final PaymentRepository paymentRepository;
	private final PaymentTransactionRepository paymentTransactionRepository;
	private final PgApiClient pgApiClient;
	private final PgApiExecutorService pgApiExecutorService;
	private final SlackApiClient slackApiClient;

	@Retryable(retryFor = Exception.class, maxAttempts = 3,
		backoff = @Backoff(delay = 1000, maxDelay = 3000, random = true))
	public void refundCancelledEnrollmentPayment(PaymentReconciliationEvent event) {
		Payment payment = paymentRepository.findById(event.getPaymentId())
			.orElseThrow(() -> new IllegalStateException("Payment not found for reconciliation: " + event.getPaymentId()));

		// 이미 환불된 결제는 다시 요청하지 않음
		if (paymentTransactionRepository.existsByPaymentIdAndTypeAndStatus(
			payment.getId(), TransactionType.REFUND, TransactionStatus.SUCCEEDED)) {
			log.info("Payment already refunded, skipping reconciliation: paymentId={}", payment.getId());
			return;
		}

		PgCancelRequest request = new PgCancelRequest(payment.getId(), payment.getTransactionId(), payment.getAmount(),
			event.getReason());
		PgCancelResponse response = pgApiExecutorService.execute("cancel", () -> pgApiClient.cancel(request));
		if (!response.isSuccess()) {
			throw new IllegalStateException("PG rejected cancel for paymentId " + payment.getId() + ": "
				+ response.getMessage());
		}

		paymentTransactionRepository.save(PaymentTransaction.refund(payment, TransactionStatus.SUCCEEDED,
			response.getCancelTransactionId(), response.getRawResponse(), LocalDateTime.now()));
		log.info("Payment reconciliation successful for paymentId: {}, enrollmentId: {}",
			payment.getId(), event.getEnrollmentId());
	}

	/**
	 * 재시도 모두 실패 시 실패한 REFUND 기록을 남기고 슬랙 알림 전송
	 */
	@Recover
	public void recoverRefund(Exception e, PaymentReconciliationEvent event) {
		log.error("Payment reconciliation FAILED for paymentId: {}, enrollmentId: {}. Reason: {}",
			event.getPaymentId(), event.getEnrollmentId(), event.getReason(), e);
		paymentRepository.findById(event.getPaymentId()).ifPresent(payment ->
			paymentTransactionRepository.save(PaymentTransaction.refund(payment, TransactionStatus.FAILED, null,
				e.getMessage(), LocalDateTime.now())));
		slackApiClient.sendSlackAlert("Payment reconciliation FAILED for paymentId: " + event.getPaymentId()
			+ ", enrollmentId: " + event.getEnrollmentId() + ". Reason: " + e.getMessage());
	}
}
