package com.example.enrollment.application.service;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.config.EnrollmentProperties;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentStatus;
import com.example.enrollment.entity.PaymentTransaction;
import com.example.enrollment.repository.PaymentRepository;
import com.example.enrollment.repository.PaymentTransactionRepository;
import com.example.enrollment.web.external.gateway.ChargeResult;
import com.example.enrollment.web.external.gateway.PaymentGateway;
import java.time.LocalDateTime;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 결제 트랜잭션 단계. PG 호출(2단계)은 트랜잭션 밖의 오케스트레이션에서 수행합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentService {

	private final EnrollmentService enrollmentService;
	private final PaymentRepository paymentRepository;
	private final PaymentTransactionRepository paymentTransactionRepository;
	private final EnrollmentProperties enrollmentProperties;

	/**
	 * 트랜잭션 1: 결제 대기 상태 확인 후 PENDING 결제 생성
	 * 진행 중인 결제가 있거나, 응답 시간 초과 결제의 실제 승인 여부를 아직 모르면
	 * 이중 출금을 막기 위해 새 결제를 만들지 않습니다.
	 */
	@Transactional
	public Payment preparePayment(String enrollmentId, PaymentGateway gateway, Map<String, String> details) {
		Enrollment enrollment = enrollmentService.getForUpdate(enrollmentId);
		if (enrollment.getStatus() != EnrollmentStatus.PAYMENT_PENDING) {
			throw new BusinessException(ErrorCode.PAYMENT_NOT_ALLOWED,
				"결제 대기 상태가 아닙니다: " + enrollment.getStatus());
		}
		if (!paymentRepository.findByEnrollmentIdAndStatus(enrollmentId, PaymentStatus.PENDING).isEmpty()) {
			throw new BusinessException(ErrorCode.PAYMENT_NOT_ALLOWED, "이미 진행 중인 결제가 있습니다");
		}
		if (paymentRepository.existsByEnrollmentIdAndStatusAndErrorCodeAndGatewayCheckedAtIsNull(
			enrollmentId, PaymentStatus.FAILED, Payment.GATEWAY_TIMEOUT)) {
			throw new BusinessException(ErrorCode.PAYMENT_VERIFICATION_PENDING,
				"이전 결제가 응답 시간 초과로 실패해 PG 승인 여부를 확인 중입니다. 확인 후 다시 결제해 주세요");
		}
		gateway.validate(details);

		Payment payment = Payment.create(enrollmentId, enrollment.getUserId(), gateway.getMethod(),
			enrollment.getFinalAmount(), enrollmentProperties.getPayment().getCurrency(),
			gateway.maskedDetails(details));
		payment = paymentRepository.save(payment);
		log.info("Payment created: paymentId={}, enrollmentId={}, method={}, amount={}",
			payment.getId(), enrollmentId, gateway.getMethod(), payment.getAmount());
		return payment;
	}

	/**
	 * 트랜잭션 3: PG 결과 반영
	 * 실패도 커밋되어야 하므로 예외 대신 결과를 반환합니다.
	 */
	@Transactional
	public PaymentOutcome completePayment(String paymentId, ChargeResult result) {
		Enrollment enrollment = lockEnrollmentOf(paymentId);
		Payment payment = getPayment(paymentId);

		// 결제 보정과 겹친 경우: 먼저 반영한 쪽의 결과를 그대로 사용
		if (!payment.isPending()) {
			log.info("Payment already finalized: paymentId={}, status={}", paymentId, payment.getStatus());
			return new PaymentOutcome(enrollment, payment, payment.getStatus() == PaymentStatus.COMPLETED, false);
		}

		LocalDateTime now = LocalDateTime.now();
		if (result.isSuccess()) {
			payment.markCompleted(result.getTransactionId(), result.getRawResponse(), result.getGatewayName(), now);
			paymentTransactionRepository.save(PaymentTransaction.charge(payment, now));

			if (enrollment.getStatus() == EnrollmentStatus.CANCELLED) {
				log.warn("Payment approved for cancelled enrollment, reconciliation required: paymentId={}, enrollmentId={}",
					paymentId, enrollment.getId());
				return new PaymentOutcome(enrollment, payment, true, true);
			}
			enrollment.transition(EnrollmentStatus.ENROLLED, PaymentStatus.COMPLETED, now);
			log.info("Payment completed: paymentId={}, enrollmentId={}, transactionId={}",
				paymentId, enrollment.getId(), result.getTransactionId());
			return new PaymentOutcome(enrollment, payment, true, false);
		}

		payment.markFailed(result.getErrorCode(), result.getErrorMessage(), result.getRawResponse(),
			result.getGatewayName(), now);
		if (enrollment.getStatus() == EnrollmentStatus.PAYMENT_PENDING) {
			enrollment.transition(EnrollmentStatus.PAYMENT_PENDING, PaymentStatus.FAILED, now);
		}
		log.warn("Payment failed: paymentId={}, enrollmentId={}, code={}, message={}",
			paymentId, enrollment.getId(), result.getErrorCode(), result.getErrorMessage());
		return new PaymentOutcome(enrollment, payment, false, false);
	}

	/**
	 * PG가 받은 적 없는 결제 (결제 보정). 수강 신청은 그대로 두어 다시 결제할 수 있습니다.
	 */
	@Transactional
	public void cancelUnsubmittedPayment(String paymentId) {
		lockEnrollmentOf(paymentId);
		Payment payment = getPayment(paymentId);
		if (!payment.isPending()) {
			return;
		}
		payment.markCancelled(LocalDateTime.now());
		log.info("Unsubmitted payment cancelled: paymentId={}, enrollmentId={}", paymentId, payment.getEnrollmentId());
	}

	/**
	 * 응답 시간 초과 결제가 PG에서 승인된 것으로 확인된 경우 (결제 보정).
	 * 실제 출금을 CHARGE로 기록하고, 환불이 필요하면 true를 반환합니다.
	 */
	@Transactional
	public boolean recordLateApproval(String paymentId, String transactionId, String gatewayResponse) {
		lockEnrollmentOf(paymentId);
		Payment payment = getPayment(paymentId);
		if (!payment.isAwaitingGatewayCheck()) {
			return false;
		}
		LocalDateTime now = LocalDateTime.now();
		payment.recordLateApproval(transactionId, gatewayResponse, now);
		paymentTransactionRepository.save(PaymentTransaction.charge(payment, now));
		log.warn("Timed-out payment was approved at PG, refund required: paymentId={}, enrollmentId={}, transactionId={}",
			paymentId, payment.getEnrollmentId(), transactionId);
		return true;
	}

	/**
	 * 응답 시간 초과 결제가 PG에서 승인되지 않은 것으로 확인된 경우. 이후 재결제가 허용됩니다.
	 */
	@Transactional
	public void markGatewayChecked(String paymentId) {
		lockEnrollmentOf(paymentId);
		Payment payment = getPayment(paymentId);
		if (!payment.isAwaitingGatewayCheck()) {
			return;
		}
		payment.markGatewayChecked(LocalDateTime.now());
		log.info("Timed-out payment confirmed not charged: paymentId={}, enrollmentId={}",
			paymentId, payment.getEnrollmentId());
	}

	// 수강 신청 행 잠금이 결제 상태 변경의 직렬화 지점
	private Enrollment lockEnrollmentOf(String paymentId) {
		String enrollmentId = paymentRepository.findEnrollmentIdById(paymentId)
			.orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
		return enrollmentService.getForUpdate(enrollmentId);
	}

	private Payment getPayment(String paymentId) {
		return paymentRepository.findById(paymentId)
			.orElseThrow(() -> new BusinessException(ErrorCode.PAYMENT_NOT_FOUND));
	}
}
