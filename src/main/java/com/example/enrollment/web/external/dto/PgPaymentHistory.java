package com.example.enrollment.web.external.dto;

import lombok.Data;

/**
 * PG 결제내역 조회 결과. found=false면 PG가 해당 결제 요청을 받은 적이 없습니다.
 */
@Data
public class PgPaymentHistory {

	private boolean found;
	private boolean approved;
	private String transactionId;
	private String errorCode;
	private String message;
	private String rawResponse;
}
