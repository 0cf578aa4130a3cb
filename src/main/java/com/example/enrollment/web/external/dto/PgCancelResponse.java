package com.example.enrollment.web.external.dto;

import lombok.Data;

@Data
public class PgCancelResponse {

	private boolean success;
	private String cancelTransactionId;
	private String message;
	private String rawResponse;
}
