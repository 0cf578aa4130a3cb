package com.example.enrollment.web.external.gateway;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.entity.Payment;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiException;
import com.example.enrollment.web.external.PgApiExecutorService;
import com.example.enrollment.web.external.dto.PgApproveRequest;
import com.example.enrollment.web.external.dto.PgApproveResponse;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public abstract class AbstractPaymentGateway implements PaymentGateway {

	private final PgApiClient pgApiClient;
	private final PgApiExecutorService pgApiExecutorService;

	protected abstract List<String> requiredFields();

	@Override
	public void validate(Map<String, String> details) {
		List<String> missing = requiredFields().stream()
			.filter(field -> details == null || isBlank(details.get(field)))
			.collect(Collectors.toList());
		if (!missing.isEmpty()) {
			throw new BusinessException(ErrorCode.MISSING_PAYMENT_DATA,
				"필수 결제 정보가 누락되었습니다: " + String.join(", ", missing));
		}
	}

	@Override
	public ChargeResult charge(Payment payment, Map<String, String> details) {
		// PG로는 필수 항목만 전달
		Map<String, String> payload = new LinkedHashMap<>();
		for (String field : requiredFields()) {
			payload.put(field, details.get(field).trim());
		}
		PgApproveRequest request = PgApproveRequest.builder()
			.paymentId(payment.getId())
			.method(getMethod().getValue())
			.amount(payment.getAmount())
			.currency(payment.getCurrency())
			.payload(payload)
			.build();

		try {
			PgApproveResponse response = pgApiExecutorService.execute("approve", () -> pgApiClient.approve(request));
			if (response.isSuccess()) {
				log.info("PG approved payment: paymentId={}, gateway={}, transactionId={}",
					payment.getId(), getName(), response.getTransactionId());
				return ChargeResult.success(response.getTransactionId(), response.getRawResponse(), getName());
			}
			log.info("PG declined payment: paymentId={}, gateway={}, code={}",
				payment.getId(), getName(), response.getErrorCode());
			return ChargeResult.failure(response.getErrorCode(), response.getMessage(), response.getRawResponse(),
				getName());
		} catch (PgApiException e) {
			return ChargeResult.failure(e.getErrorCode(), e.getMessage(), null, getName());
		}
	}

	protected static String lastFour(String value) {
		String digits = value == null ? "" : value.replaceAll("\\D", "");
		return digits.length() <= 4 ? digits : digits.substring(digits.length() - 4);
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
