package com.example.enrollment.web.controller.dto;

import com.example.enrollment.entity.EnrollmentStatus;
import lombok.Builder;
import lombok.Getter;

/**
 * reasonCode: NOT_ENROLLED | PAYMENT_PENDING | ENROLLMENT_EXPIRED (접근 불가일 때만)
 */
@Getter
@Builder
public class CourseAccessResponse {

	public static final String NOT_ENROLLED = "NOT_ENROLLED";
	public static final String PAYMENT_PENDING = "PAYMENT_PENDING";
	public static final String ENROLLMENT_EXPIRED = "ENROLLMENT_EXPIRED";

	private final boolean hasAccess;
	private final EnrollmentStatus enrollmentStatus;
	private final String nextLessonUrl;
	private final String reasonCode;
	private final String message;
}
