package com.example.enrollment.web.external;

import com.example.enrollment.entity.Payment;
import lombok.Getter;

/**
 * PG 호출 자체가 실패한 경우 (타임아웃, 통신 오류). 승인 거절과는 구분됩니다.
 */
@Getter
public class PgApiException extends RuntimeException {

	public static final String GATEWAY_TIMEOUT = Payment.GATEWAY_TIMEOUT;
	public static final String GATEWAY_ERROR = "GATEWAY_ERROR";

	private final String errorCode;

	public PgApiException(String errorCode, String message, Throwable cause) {
		super(message, cause);
		this.errorCode = errorCode;
	}
}
