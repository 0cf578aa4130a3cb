package com.example.enrollment.application.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * PG 승인은 됐지만 수강 신청이 이미 취소된 경우 발행됩니다. 리스너가 PG 결제 취소(환불)를 수행합니다.
 */
@Getter
public class PaymentReconciliationEvent extends ApplicationEvent {
	private final String paymentId;
	private final String enrollmentId;
	private final String reason;

	public PaymentReconciliationEvent(Object source, String paymentId, String enrollmentId, String reason) {
		super(source);
		this.paymentId = paymentId;
		this.enrollmentId = enrollmentId;
		this.reason = reason;
	}
}
