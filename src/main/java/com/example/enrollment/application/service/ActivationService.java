package com.example.enrollment.application.service;

import com.example.enrollment.application.event.ActivationExhaustedEvent;
import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.web.controller.dto.ActivationResult;
import com.example.enrollment.web.external.ProvisioningExecutorService;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 결제 완료된 수강 신청의 강의 접근 권한 활성화
 * 실패해도 취소/환불하지 않고 이미 부여된 접근 권한도 회수하지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ActivationService {

	private final EnrollmentService enrollmentService;
	private final ProvisioningExecutorService provisioningExecutorService;
	private final ActivationBackoffPolicy activationBackoffPolicy;
	private final ApplicationEventPublisher eventPublisher;

	/**
	 * 이미 ACTIVE인 경우 LMS를 다시 호출하지 않고 성공 결과를 반환합니다.
	 */
	@Transactional
	public ActivationResult activate(String enrollmentId) {
		Enrollment enrollment = enrollmentService.getForUpdate(enrollmentId);
		if (enrollment.getStatus() == EnrollmentStatus.ACTIVE) {
			return granted(enrollment, "Course access already active");
		}
		if (!enrollment.isEligibleForActivation()) {
			throw new BusinessException(ErrorCode.NOT_ELIGIBLE_FOR_ACTIVATION,
				"활성화할 수 없는 상태입니다: " + enrollment.getStatus() + "/" + enrollment.getPaymentStatus());
		}
		return attemptActivation(enrollment, LocalDateTime.now());
	}

	@Transactional
	public ActivationResult retryActivation(String enrollmentId) {
		Enrollment enrollment = enrollmentService.getForUpdate(enrollmentId);
		LocalDateTime now = LocalDateTime.now();
		if (!enrollment.canRetryActivation(now)) {
			throw new BusinessException(ErrorCode.NO_RETRIES_AVAILABLE);
		}
		return attemptActivation(enrollment, now);
	}

	private ActivationResult attemptActivation(Enrollment enrollment, LocalDateTime now) {
		if (enrollment.getStatus() == EnrollmentStatus.ENROLLED) {
			enrollment.transition(EnrollmentStatus.ACTIVATING, null, now);
		}
		if (provisioningExecutorService.provision(enrollment)) {
			enrollment.transition(EnrollmentStatus.ACTIVE, null, now);
			log.info("Course access activated: enrollmentId={}, attempts={}",
				enrollment.getId(), enrollment.getActivationAttempts());
			return granted(enrollment, "Course access activated");
		}

		int attempts = enrollment.recordActivationFailure();
		if (enrollment.hasActivationRetriesLeft()) {
			LocalDateTime nextRetryAt = activationBackoffPolicy.nextRetryAt(now, attempts);
			enrollment.scheduleActivationRetry(nextRetryAt);
			log.warn("Course activation failed, retry scheduled: enrollmentId={}, attempts={}/{}, nextRetryAt={}",
				enrollment.getId(), attempts, enrollment.getMaxRetries(), nextRetryAt);
			return ActivationResult.builder()
				.enrollmentId(enrollment.getId())
				.granted(false)
				.accessGranted(enrollment.isAccessGranted())
				.retryAvailable(true)
				.estimatedCompletion(nextRetryAt)
				.activationAttempts(attempts)
				.message("Course activation failed, retry scheduled")
				.build();
		}

		enrollment.scheduleActivationRetry(null);
		log.error("Course activation retries exhausted: enrollmentId={}, attempts={}", enrollment.getId(), attempts);
		eventPublisher.publishEvent(new ActivationExhaustedEvent(this, enrollment.getId(), enrollment.getUserId(),
			enrollment.getCourseId(), attempts));
		return ActivationResult.builder()
			.enrollmentId(enrollment.getId())
			.granted(false)
			.accessGranted(enrollment.isAccessGranted())
			.retryAvailable(false)
			.activationAttempts(attempts)
			.message("Course activation failed, no retries left")
			.build();
	}

	private ActivationResult granted(Enrollment enrollment, String message) {
		return ActivationResult.builder()
			.enrollmentId(enrollment.getId())
			.granted(true)
			.accessGranted(true)
			.firstLessonUrl("/courses/" + enrollment.getCourseId() + "/lessons/1")
			.retryAvailable(false)
			.activationTime(enrollment.getActivationDate())
			.activationAttempts(enrollment.getActivationAttempts())
			.message(message)
			.build();
	}
}
