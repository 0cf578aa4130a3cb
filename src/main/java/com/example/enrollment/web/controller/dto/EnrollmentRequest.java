package com.example.enrollment.web.controller.dto;

import lombok.Data;

@Data
public class EnrollmentRequest {

	private Long courseId;
	private String fullName;
	private String email;
	private String discountCode;
}
