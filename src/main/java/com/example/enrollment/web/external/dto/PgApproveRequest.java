package com.example.enrollment.web.external.dto;

import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * PG 승인 요청. paymentId는 PG 측 멱등키로 사용됩니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PgApproveRequest {

	private String paymentId;
	private String method;
	private BigDecimal amount;
	private String currency;
	private Map<String, String> payload;
}
