package com.example.enrollment.application.service;

import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.Payment;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 결제 3단계(결과 반영) 결과
 * reconciliationRequired: 승인은 됐지만 그 사이 수강 신청이 취소되어 환불이 필요한 경우
 */
@Getter
@AllArgsConstructor
public class PaymentOutcome {

	private final Enrollment enrollment;
	private final Payment payment;
	private final boolean success;
	private final boolean reconciliationRequired;
}
