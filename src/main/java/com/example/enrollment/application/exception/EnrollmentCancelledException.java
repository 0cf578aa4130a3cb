package com.example.enrollment.application.exception;

import lombok.Getter;

/**
 * PG 승인 대기 중 수강 신청이 취소된 경우. 승인된 금액은 비동기로 환불됩니다.
 */
@Getter
public class EnrollmentCancelledException extends BusinessException {

	private final String paymentId;
	private final String enrollmentId;

	public EnrollmentCancelledException(String paymentId, String enrollmentId) {
		super(ErrorCode.ENROLLMENT_CANCELLED, "결제 중 수강 신청이 취소되어 승인된 금액을 환불합니다");
		this.paymentId = paymentId;
		this.enrollmentId = enrollmentId;
	}
}
