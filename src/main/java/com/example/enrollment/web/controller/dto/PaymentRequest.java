package com.example.enrollment.web.controller.dto;

import java.util.Map;
import lombok.Data;

/**
 * paymentMethod: credit_card | paypal | bank_transfer
 * paymentDetails 필수 항목은 결제 수단별로 다릅니다.
 */
@Data
public class PaymentRequest {

	private String paymentMethod;
	private Map<String, String> paymentDetails;
}
