package com.example.enrollment.web.controller.dto;

import com.example.enrollment.entity.MaskedPaymentDetails;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentStatus;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PaymentResponse {

	private final String id;
	private final String paymentMethod;
	private final PaymentStatus status;
	private final BigDecimal amount;
	private final String currency;
	private final String transactionId;
	private final String errorCode;
	private final String errorMessage;
	private final String lastFourDigits;
	private final LocalDateTime createdAt;
	private final LocalDateTime processedAt;

	public static PaymentResponse from(Payment payment) {
		MaskedPaymentDetails details = payment.getDetails();
		return PaymentResponse.builder()
			.id(payment.getId())
			.paymentMethod(payment.getPaymentMethod().getValue())
			.status(payment.getStatus())
			.amount(payment.getAmount())
			.currency(payment.getCurrency())
			.transactionId(payment.getTransactionId())
			.errorCode(payment.getErrorCode())
			.errorMessage(payment.getErrorMessage())
			.lastFourDigits(details == null ? null : details.getLastFourDigits())
			.createdAt(payment.getCreatedAt())
			.processedAt(payment.getProcessedAt())
			.build();
	}
}
