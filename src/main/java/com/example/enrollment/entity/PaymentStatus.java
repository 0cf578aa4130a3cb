package com.example.enrollment.entity;

/**
 * 결제 상태 (Payment, Enrollment 공용)
 */
public enum PaymentStatus {
	PENDING,
	COMPLETED,
	FAILED,
	CANCELLED;

	public boolean isFinal() {
		return this != PENDING;
	}
}
