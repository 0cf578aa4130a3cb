package com.example.enrollment.entity;

import java.util.Arrays;
import java.util.Optional;

public enum PaymentMethod {
	CREDIT_CARD("credit_card"),
	PAYPAL("paypal"),
	BANK_TRANSFER("bank_transfer");

	private final String value;

	PaymentMethod(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}

	/**
	 * "credit_card", "CREDIT_CARD" 둘 다 허용
	 */
	public static Optional<PaymentMethod> from(String raw) {
		if (raw == null) {
			return Optional.empty();
		}
		String normalized = raw.trim();
		return Arrays.stream(values())
			.filter(m -> m.value.equalsIgnoreCase(normalized) || m.name().equalsIgnoreCase(normalized))
			.findFirst();
	}
}
