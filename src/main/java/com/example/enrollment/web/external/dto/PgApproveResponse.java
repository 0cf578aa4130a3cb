package com.example.enrollment.web.external.dto;

import lombok.Data;

@Data
public class PgApproveResponse {

	private boolean success;
	private String transactionId;
	private String errorCode;
	private String message;
	private String rawResponse;

	public static PgApproveResponse approved(String transactionId, String rawResponse) {
		PgApproveResponse response = new PgApproveResponse();
		response.setSuccess(true);
		response.setTransactionId(transactionId);
		response.setMessage("Payment Success");
		response.setRawResponse(rawResponse);
		return response;
	}

	public static PgApproveResponse declined(String errorCode, String message, String rawResponse) {
		PgApproveResponse response = new PgApproveResponse();
		response.setSuccess(false);
		response.setErrorCode(errorCode);
		response.setMessage(message);
		response.setRawResponse(rawResponse);
		return response;
	}
}
