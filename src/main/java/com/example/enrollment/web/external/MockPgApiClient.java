package com.example.enrollment.web.external;

import com.example.enrollment.config.PgProperties;
import com.example.enrollment.entity.PaymentMethod;
import com.example.enrollment.web.external.dto.PgApproveRequest;
import com.example.enrollment.web.external.dto.PgApproveResponse;
import com.example.enrollment.web.external.dto.PgCancelRequest;
import com.example.enrollment.web.external.dto.PgCancelResponse;
import com.example.enrollment.web.external.dto.PgPaymentHistory;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * 개발/테스트용 PG (prod 제외)
 * 설정된 거절 카드번호/PayPal 계정만 거절하고 나머지는 모두 승인합니다. 결과는 항상 동일합니다.
 * 승인 결과는 최근 pg.mock.max-tracked-payments건까지만 보관하며, 밀려난 결제는 결제내역 조회 시 found=false입니다.
 */
@Slf4j
@Component
@Profile("!prod")
public class MockPgApiClient implements PgApiClient {

	private final PgProperties pgProperties;

	// paymentId -> 승인 결과 (결제내역 조회, 멱등 처리용), 오래된 순으로 제거
	private final Map<String, PgApproveResponse> approvals;

	public MockPgApiClient(PgProperties pgProperties) {
		this.pgProperties = pgProperties;
		int maxTracked = pgProperties.getMock().getMaxTrackedPayments();
		this.approvals = Collections.synchronizedMap(new LinkedHashMap<String, PgApproveResponse>(16, 0.75f, false) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<String, PgApproveResponse> eldest) {
				return size() > maxTracked;
			}
		});
	}

	@Override
	public PgApproveResponse approve(PgApproveRequest request) {
		return approvals.computeIfAbsent(request.getPaymentId(), paymentId -> decide(request));
	}

	@Override
	public PgCancelResponse cancel(PgCancelRequest request) {
		PgCancelResponse response = new PgCancelResponse();
		response.setSuccess(true);
		response.setCancelTransactionId("cxl_" + request.getTransactionId());
		response.setMessage("Cancel Success");
		response.setRawResponse("{\"status\":\"cancelled\",\"transaction_id\":\"" + request.getTransactionId() + "\"}");
		log.info("Mock PG cancel: paymentId={}, transactionId={}", request.getPaymentId(), request.getTransactionId());
		return response;
	}

	@Override
	public PgPaymentHistory findPaymentHistory(String paymentId) {
		PgPaymentHistory history = new PgPaymentHistory();
		PgApproveResponse approval = approvals.get(paymentId);
		if (approval == null) {
			history.setFound(false);
			return history;
		}
		history.setFound(true);
		history.setApproved(approval.isSuccess());
		history.setTransactionId(approval.getTransactionId());
		history.setErrorCode(approval.getErrorCode());
		history.setMessage(approval.getMessage());
		history.setRawResponse(approval.getRawResponse());
		return history;
	}

	private PgApproveResponse decide(PgApproveRequest request) {
		PaymentMethod method = PaymentMethod.from(request.getMethod()).orElse(null);
		Map<String, String> payload = request.getPayload() == null ? Map.of() : request.getPayload();
		PgProperties.Mock mock = pgProperties.getMock();

		if (method == PaymentMethod.CREDIT_CARD && mock.getDeclineCardNumber().equals(payload.get("cardNumber"))) {
			log.info("Mock PG declined card payment: paymentId={}", request.getPaymentId());
			return PgApproveResponse.declined("CARD_DECLINED", "Credit card declined", "Insufficient funds");
		}
		if (method == PaymentMethod.PAYPAL && mock.getDeclinePaypalEmail().equalsIgnoreCase(payload.get("paypalEmail"))) {
			log.info("Mock PG declined PayPal payment: paymentId={}", request.getPaymentId());
			return PgApproveResponse.declined("PAYPAL_DECLINED", "PayPal payment declined", "Account restricted");
		}

		String transactionId = prefix(method) + request.getPaymentId().replace("-", "").substring(0, 16);
		return PgApproveResponse.approved(transactionId,
			"{\"status\":\"approved\",\"transaction_id\":\"" + transactionId + "\"}");
	}

	private String prefix(PaymentMethod method) {
		if (method == PaymentMethod.PAYPAL) {
			return "pp_";
		}
		if (method == PaymentMethod.BANK_TRANSFER) {
			return "bt_";
		}
		return "txn_";
	}
}
