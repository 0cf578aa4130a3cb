package com.example.enrollment.web.external;

import com.example.enrollment.web.external.dto.PgApproveRequest;
import com.example.enrollment.web.external.dto.PgApproveResponse;
import com.example.enrollment.web.external.dto.PgCancelRequest;
import com.example.enrollment.web.external.dto.PgCancelResponse;
import com.example.enrollment.web.external.dto.PgPaymentHistory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

/**
 * 운영 PG 연동 (RestTemplate). 거절은 200 + success=false로 내려오고, 그 외 HTTP 오류는 예외로 전파됩니다.
 */
@Slf4j
@Component
@Profile("prod")
@RequiredArgsConstructor
public class RestPgApiClient implements PgApiClient {

	static final String APPROVE_PATH = "/v1/payments/approve";
	static final String CANCEL_PATH = "/v1/payments/cancel";
	static final String HISTORY_PATH = "/v1/payments/{paymentId}";

	private final RestTemplate restTemplate;

	@Override
	public PgApproveResponse approve(PgApproveRequest request) {
		PgApproveResponse response = restTemplate.postForObject(APPROVE_PATH, request, PgApproveResponse.class);
		if (response == null) {
			throw new IllegalStateException("Empty approve response from PG: paymentId=" + request.getPaymentId());
		}
		return response;
	}

	@Override
	public PgCancelResponse cancel(PgCancelRequest request) {
		PgCancelResponse response = restTemplate.postForObject(CANCEL_PATH, request, PgCancelResponse.class);
		if (response == null) {
			throw new IllegalStateException("Empty cancel response from PG: paymentId=" + request.getPaymentId());
		}
		return response;
	}

	@Override
	public PgPaymentHistory findPaymentHistory(String paymentId) {
		try {
			PgPaymentHistory history = restTemplate.getForObject(HISTORY_PATH, PgPaymentHistory.class, paymentId);
			if (history == null) {
				throw new IllegalStateException("Empty history response from PG: paymentId=" + paymentId);
			}
			return history;
		} catch (HttpClientErrorException.NotFound e) {
			log.info("PG has no record of payment: paymentId={}", paymentId);
			PgPaymentHistory history = new PgPaymentHistory();
			history.setFound(false);
			return history;
		}
	}
}
