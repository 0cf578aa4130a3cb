package com.example.enrollment.web.external.dto;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PgCancelRequest {

	private String paymentId;
	private String transactionId;
	private BigDecimal amount;
	private String reason;
}
