package com.example.enrollment.web.external.gateway;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.entity.PaymentMethod;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class PaymentGatewayRegistry {

	private final Map<PaymentMethod, PaymentGateway> gateways = new EnumMap<>(PaymentMethod.class);

	public PaymentGatewayRegistry(List<PaymentGateway> paymentGateways) {
		for (PaymentGateway gateway : paymentGateways) {
			gateways.put(gateway.getMethod(), gateway);
		}
	}

	public PaymentGateway get(PaymentMethod method) {
		PaymentGateway gateway = gateways.get(method);
		if (gateway == null) {
			throw new BusinessException(ErrorCode.INVALID_PAYMENT_METHOD,
				"지원하지 않는 결제 수단입니다: " + method);
		}
		return gateway;
	}

	/** "credit_card" 같은 요청 값으로 조회 */
	public PaymentGateway get(String rawMethod) {
		PaymentMethod method = PaymentMethod.from(rawMethod)
			.orElseThrow(() -> new BusinessException(ErrorCode.INVALID_PAYMENT_METHOD,
				"지원하지 않는 결제 수단입니다: " + rawMethod));
		return get(method);
	}
}
