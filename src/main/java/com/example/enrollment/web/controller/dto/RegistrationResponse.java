package com.example.enrollment.web.controller.dto;

import com.example.enrollment.entity.Enrollment;
import lombok.Getter;

@Getter
public class RegistrationResponse {

	private final EnrollmentResponse enrollment;
	private final boolean paymentRequired;
	private final String paymentUrl;
	private final boolean accessImmediate;

	private RegistrationResponse(Enrollment enrollment) {
		this.enrollment = EnrollmentResponse.from(enrollment);
		this.paymentRequired = enrollment.isPaymentRequired();
		this.paymentUrl = paymentRequired ? "/payment/process/" + enrollment.getId() : null;
		this.accessImmediate = !paymentRequired;
	}

	public static RegistrationResponse from(Enrollment enrollment) {
		return new RegistrationResponse(enrollment);
	}
}
