package com.example.enrollment.application.orchestration;

import com.example.enrollment.application.event.PaymentReconciliationEvent;
import com.example.enrollment.application.exception.EnrollmentCancelledException;
import com.example.enrollment.application.exception.PaymentFailedException;
import com.example.enrollment.application.service.PaymentOutcome;
import com.example.enrollment.application.service.PaymentService;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.web.controller.dto.PaymentRequest;
import com.example.enrollment.web.external.gateway.ChargeResult;
import com.example.enrollment.web.external.gateway.PaymentGateway;
import com.example.enrollment.web.external.gateway.PaymentGatewayRegistry;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentPaymentOrchestration {

	private final PaymentService paymentService;
	private final PaymentGatewayRegistry paymentGatewayRegistry;
	private final ApplicationEventPublisher eventPublisher;

	/**
	 * 수강료 결제 오케스트레이션
	 * 1. (트랜잭션) PENDING 결제 생성
	 * 2. (트랜잭션 없음) PG 승인 요청
	 * 3. (트랜잭션) 승인 결과 반영
	 * 승인 대기 중 수강 신청이 취소되었으면 환불을 요청하고 EnrollmentCancelledException을 던집니다.
	 * 3단계가 실패하면 결제는 PENDING으로 남고 결제 보정 스케줄러가 PG 결제내역으로 마무리합니다.
	 */
	public Enrollment processPayment(String enrollmentId, PaymentRequest request) {
		PaymentGateway gateway = paymentGatewayRegistry.get(request.getPaymentMethod());
		Map<String, String> details = request.getPaymentDetails() == null ? Map.of() : request.getPaymentDetails();

		// 트랜잭션 1
		Payment payment = paymentService.preparePayment(enrollmentId, gateway, details);

		// PG 호출: 실패는 결과로 돌아오며 예외를 던지지 않음
		ChargeResult result = gateway.charge(payment, details);

		// 트랜잭션 3
		PaymentOutcome outcome;
		try {
			outcome = paymentService.completePayment(payment.getId(), result);
		} catch (RuntimeException e) {
			log.error("Payment finalization failed, left PENDING for adjustment: paymentId={}, enrollmentId={}, pgSuccess={}",
				payment.getId(), enrollmentId, result.isSuccess(), e);
			throw e;
		}

		if (outcome.isReconciliationRequired()) {
			eventPublisher.publishEvent(new PaymentReconciliationEvent(this, payment.getId(), enrollmentId,
				"수강 신청 취소 후 결제 승인"));
			throw new EnrollmentCancelledException(payment.getId(), enrollmentId);
		}
		if (!outcome.isSuccess()) {
			Payment failed = outcome.getPayment();
			throw new PaymentFailedException(failed.getId(), failed.getErrorCode(),
				failed.getErrorMessage() == null ? "결제 처리에 실패했습니다" : failed.getErrorMessage(),
				failed.getGatewayResponse());
		}
		return outcome.getEnrollment();
	}
}
