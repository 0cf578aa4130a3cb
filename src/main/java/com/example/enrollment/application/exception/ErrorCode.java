package com.example.enrollment.application.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 비즈니스 에러 코드 정의
 * code 값은 응답 바디에 그대로 노출되므로 변경 시 클라이언트와 협의가 필요합니다.
 */
@Getter
@RequiredArgsConstructor
public enum ErrorCode {

	// 입력값
	VALIDATION_ERROR("VALIDATION_ERROR", "입력값이 올바르지 않습니다"),

	// 조회 대상 없음
	COURSE_NOT_FOUND("COURSE_NOT_FOUND", "강의를 찾을 수 없습니다"),
	USER_NOT_FOUND("USER_NOT_FOUND", "사용자를 찾을 수 없습니다"),
	ENROLLMENT_NOT_FOUND("ENROLLMENT_NOT_FOUND", "수강 신청 내역을 찾을 수 없습니다"),
	PAYMENT_NOT_FOUND("PAYMENT_NOT_FOUND", "결제 내역을 찾을 수 없습니다"),

	// 수강 신청
	DUPLICATE_ENROLLMENT("DUPLICATE_ENROLLMENT", "이미 수강 신청한 강의입니다"),
	INVALID_DISCOUNT("INVALID_DISCOUNT", "유효하지 않은 할인 코드입니다"),
	INVALID_TRANSITION("INVALID_TRANSITION", "허용되지 않는 상태 변경입니다"),

	// 결제
	PAYMENT_NOT_ALLOWED("PAYMENT_NOT_ALLOWED", "결제 대기 상태의 수강 신청이 아닙니다"),
	INVALID_PAYMENT_METHOD("INVALID_PAYMENT_METHOD", "지원하지 않는 결제 수단입니다"),
	MISSING_PAYMENT_DATA("MISSING_PAYMENT_DATA", "결제 정보가 누락되었습니다"),
	PAYMENT_FAILED("PAYMENT_FAILED", "결제 처리에 실패했습니다"),
	PAYMENT_VERIFICATION_PENDING("PAYMENT_VERIFICATION_PENDING", "이전 결제의 승인 여부를 확인 중입니다"),
	ENROLLMENT_CANCELLED("ENROLLMENT_CANCELLED", "결제 중 수강 신청이 취소되었습니다"),

	// 활성화
	NOT_ELIGIBLE_FOR_ACTIVATION("NOT_ELIGIBLE_FOR_ACTIVATION", "활성화할 수 없는 수강 신청입니다"),
	NO_RETRIES_AVAILABLE("NO_RETRIES_AVAILABLE", "재시도 가능한 활성화가 없습니다"),

	INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "서버 내부 오류가 발생했습니다");

	private final String code;
	private final String message;
}
