package com.example.enrollment.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * 수강 신청 상태
 * PENDING -> PAYMENT_PENDING -> ENROLLED -> ACTIVATING -> ACTIVE, 종료 전 어느 상태에서든 CANCELLED 가능
 */
public enum EnrollmentStatus {
	PENDING,
	PAYMENT_PENDING,
	ENROLLED,
	ACTIVATING,
	ACTIVE,
	CANCELLED;

	public boolean isTerminal() {
		return this == ACTIVE || this == CANCELLED;
	}

	public boolean canTransitionTo(EnrollmentStatus target) {
		if (isTerminal()) {
			return false;
		}
		if (target == CANCELLED) {
			return true;
		}
		return allowedTargets().contains(target);
	}

	private Set<EnrollmentStatus> allowedTargets() {
		switch (this) {
			case PENDING:
				return EnumSet.of(PAYMENT_PENDING, ENROLLED);
			case PAYMENT_PENDING:
				// 결제 실패 후 재시도는 상태 유지
				return EnumSet.of(PAYMENT_PENDING, ENROLLED);
			case ENROLLED:
				return EnumSet.of(ACTIVATING);
			case ACTIVATING:
				return EnumSet.of(ACTIVATING, ACTIVE);
			default:
				return EnumSet.noneOf(EnrollmentStatus.class);
		}
	}
}
