package com.example.enrollment.web.external.gateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 수단과 무관한 PG 승인 결과
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChargeResult {

	private final boolean success;
	private final String transactionId;
	private final String errorCode;
	private final String errorMessage;
	private final String rawResponse;
	private final String gatewayName;

	public static ChargeResult success(String transactionId, String rawResponse, String gatewayName) {
		return new ChargeResult(true, transactionId, null, null, rawResponse, gatewayName);
	}

	public static ChargeResult failure(String errorCode, String errorMessage, String rawResponse, String gatewayName) {
		return new ChargeResult(false, null, errorCode, errorMessage, rawResponse, gatewayName);
	}
}
