package com.example.enrollment.web.controller.dto;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ErrorResponse {

	private final String code;
	private final String message;
	private final Object details;

	public static ErrorResponse of(String code, String message) {
		return new ErrorResponse(code, message, null);
	}

	public static ErrorResponse of(String code, String message, Object details) {
		return new ErrorResponse(code, message, details);
	}
}
