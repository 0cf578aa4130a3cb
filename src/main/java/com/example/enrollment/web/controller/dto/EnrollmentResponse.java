package com.example.enrollment.web.controller.dto;

import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.entity.PaymentStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EnrollmentResponse {

	private final String id;
	private final Long userId;
	private final Long courseId;
	private final String fullName;
	private final String email;
	private final EnrollmentStatus status;
	private final PaymentStatus paymentStatus;
	private final BigDecimal paymentAmount;
	private final String discountCode;
	private final BigDecimal discountApplied;
	private final BigDecimal finalAmount;
	private final boolean accessGranted;
	private final LocalDateTime enrollmentDate;
	private final LocalDateTime activationDate;
	private final int activationAttempts;
	private final int maxRetries;
	private final LocalDateTime nextRetryAt;

	public static EnrollmentResponse from(Enrollment enrollment) {
		return EnrollmentResponse.builder()
			.id(enrollment.getId())
			.userId(enrollment.getUserId())
			.courseId(enrollment.getCourseId())
			.fullName(enrollment.getFullName())
			.email(enrollment.getEmail())
			.status(enrollment.getStatus())
			.paymentStatus(enrollment.getPaymentStatus())
			.paymentAmount(enrollment.getPaymentAmount())
			.discountCode(enrollment.getDiscountCode())
			.discountApplied(enrollment.getDiscountApplied())
			.finalAmount(enrollment.getFinalAmount())
			.accessGranted(enrollment.isAccessGranted())
			.enrollmentDate(enrollment.getEnrollmentDate())
			.activationDate(enrollment.getActivationDate())
			.activationAttempts(enrollment.getActivationAttempts())
			.maxRetries(enrollment.getMaxRetries())
			.nextRetryAt(enrollment.getNextRetryAt())
			.build();
	}
}
