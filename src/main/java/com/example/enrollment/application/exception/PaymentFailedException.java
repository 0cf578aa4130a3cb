package com.example.enrollment.application.exception;

import lombok.Getter;

/**
 * PG 승인 거절/타임아웃. Payment는 FAILED로 기록된 뒤 던져지며, 수강 신청은 PAYMENT_PENDING으로 남습니다.
 */
@Getter
public class PaymentFailedException extends BusinessException {

	private final String paymentId;
	private final String gatewayErrorCode;
	private final String gatewayResponse;

	public PaymentFailedException(String paymentId, String gatewayErrorCode, String message, String gatewayResponse) {
		super(ErrorCode.PAYMENT_FAILED, message);
		this.paymentId = paymentId;
		this.gatewayErrorCode = gatewayErrorCode;
		this.gatewayResponse = gatewayResponse;
	}
}
