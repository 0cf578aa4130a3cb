package com.example.enrollment.application.event;

import com.example.enrollment.application.service.PaymentReconciliationService;
import com.example.enrollment.web.external.SlackApiClient;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@RequiredArgsConstructor
public class EnrollmentEventListener {

	private final PaymentReconciliationService paymentReconciliationService;
	private final SlackApiClient slackApiClient;

	// 결제 기록이 커밋된 뒤에만 환불 (트랜잭션 밖에서 발행되면 즉시 실행)
	@TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
	@Async
	public void reconcilePayment(PaymentReconciliationEvent event) {
		paymentReconciliationService.refundCancelledEnrollmentPayment(event);
	}

	@TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
	@Async
	public void alertActivationExhausted(ActivationExhaustedEvent event) {
		slackApiClient.sendSlackAlert("Course activation retries exhausted for enrollmentId: " + event.getEnrollmentId()
			+ ", userId: " + event.getUserId() + ", courseId: " + event.getCourseId()
			+ ", attempts: " + event.getAttempts());
	}
}
