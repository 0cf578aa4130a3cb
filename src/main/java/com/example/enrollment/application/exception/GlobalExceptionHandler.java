package com.example.enrollment.application.exception;

import com.example.enrollment.web.controller.dto.ErrorResponse;
import com.example.enrollment.web.controller.dto.PaymentErrorResponse;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

	@ExceptionHandler(PaymentFailedException.class)
	public ResponseEntity<PaymentErrorResponse> handlePaymentFailedException(PaymentFailedException ex) {
		log.warn("Payment failed: paymentId={}, gatewayCode={}, message={}",
			ex.getPaymentId(), ex.getGatewayErrorCode(), ex.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(PaymentErrorResponse.from(ex));
	}

	@ExceptionHandler(EnrollmentCancelledException.class)
	public ResponseEntity<ErrorResponse> handleEnrollmentCancelledException(EnrollmentCancelledException ex) {
		log.warn("Enrollment cancelled during payment, refund pending: paymentId={}, enrollmentId={}",
			ex.getPaymentId(), ex.getEnrollmentId());
		return ResponseEntity.status(HttpStatus.CONFLICT)
			.body(ErrorResponse.of(ex.getCode(), ex.getMessage(),
				Map.of("paymentId", ex.getPaymentId(), "refundPending", true)));
	}

	@ExceptionHandler(BusinessException.class)
	public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
		log.warn("Business exception occurred: code={}, message={}", ex.getCode(), ex.getMessage());
		return ResponseEntity.status(mapErrorCodeToHttpStatus(ex.getErrorCode()))
			.body(ErrorResponse.of(ex.getCode(), ex.getMessage()));
	}

	@ExceptionHandler({
		HttpMessageNotReadableException.class,
		MissingRequestHeaderException.class,
		MissingServletRequestParameterException.class,
		MethodArgumentTypeMismatchException.class
	})
	public ResponseEntity<ErrorResponse> handleBindingException(Exception ex) {
		log.warn("Malformed request: {}", ex.getMessage());
		return ResponseEntity.status(HttpStatus.BAD_REQUEST)
			.body(ErrorResponse.of(ErrorCode.VALIDATION_ERROR.getCode(), ErrorCode.VALIDATION_ERROR.getMessage(),
				invalidField(ex)));
	}

	@ExceptionHandler(Exception.class)
	public ResponseEntity<ErrorResponse> handleException(Exception ex) {
		// 내부 정보는 응답에 노출하지 않음
		log.error("Unexpected exception occurred", ex);
		return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
			.body(ErrorResponse.of(ErrorCode.INTERNAL_SERVER_ERROR.getCode(), ErrorCode.INTERNAL_SERVER_ERROR.getMessage()));
	}

	// 문제가 된 헤더/파라미터 이름 (본문 파싱 오류는 null)
	private String invalidField(Exception ex) {
		if (ex instanceof MissingRequestHeaderException) {
			return ((MissingRequestHeaderException) ex).getHeaderName();
		}
		if (ex instanceof MissingServletRequestParameterException) {
			return ((MissingServletRequestParameterException) ex).getParameterName();
		}
		if (ex instanceof MethodArgumentTypeMismatchException) {
			return ((MethodArgumentTypeMismatchException) ex).getName();
		}
		return null;
	}

	private HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
		switch (errorCode) {
			case COURSE_NOT_FOUND:
			case USER_NOT_FOUND:
			case ENROLLMENT_NOT_FOUND:
			case PAYMENT_NOT_FOUND:
				return HttpStatus.NOT_FOUND;
			case PAYMENT_VERIFICATION_PENDING:
			case ENROLLMENT_CANCELLED:
				return HttpStatus.CONFLICT;
			case INTERNAL_SERVER_ERROR:
				return HttpStatus.INTERNAL_SERVER_ERROR;
			default:
				return HttpStatus.BAD_REQUEST;
		}
	}
}
