package com.example.enrollment.web.external.gateway;

import com.example.enrollment.entity.MaskedPaymentDetails;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentMethod;
import java.util.Map;

public interface PaymentGateway {

	PaymentMethod getMethod();

	String getName();

	/**
	 * 필수 결제 정보 확인. 누락 시 MISSING_PAYMENT_DATA (PG 호출 전)
	 */
	void validate(Map<String, String> details);

	MaskedPaymentDetails maskedDetails(Map<String, String> details);

	/**
	 * PG 승인 요청. 거절/타임아웃/통신 오류 모두 실패 결과로 반환하며 예외를 던지지 않습니다.
	 */
	ChargeResult charge(Payment payment, Map<String, String> details);
}
