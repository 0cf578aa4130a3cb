package com.example.enrollment.web.controller.dto;

import com.example.enrollment.application.exception.PaymentFailedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 실패 응답. paymentError는 사용자 표시용, errorCode/gatewayResponse는 PG가 준 값 그대로입니다.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentErrorResponse {

	private final String code;
	private final String message;
	private final String paymentId;
	private final String paymentError;
	private final String errorCode;
	private final String gatewayResponse;

	public static PaymentErrorResponse from(PaymentFailedException ex) {
		return new PaymentErrorResponse(ex.getCode(), ex.getErrorCode().getMessage(), ex.getPaymentId(),
			ex.getMessage(), ex.getGatewayErrorCode(), ex.getGatewayResponse());
	}
}
