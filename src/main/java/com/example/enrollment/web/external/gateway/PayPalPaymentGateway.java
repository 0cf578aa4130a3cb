package com.example.enrollment.web.external.gateway;

import com.example.enrollment.entity.MaskedPaymentDetails;
import com.example.enrollment.entity.PaymentMethod;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiExecutorService;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class PayPalPaymentGateway extends AbstractPaymentGateway {

	public PayPalPaymentGateway(PgApiClient pgApiClient, PgApiExecutorService pgApiExecutorService) {
		super(pgApiClient, pgApiExecutorService);
	}

	@Override
	public PaymentMethod getMethod() {
		return PaymentMethod.PAYPAL;
	}

	@Override
	public String getName() {
		return "paypal";
	}

	@Override
	protected List<String> requiredFields() {
		return List.of("paypalEmail");
	}

	@Override
	public MaskedPaymentDetails maskedDetails(Map<String, String> details) {
		return MaskedPaymentDetails.builder()
			.paypalEmail(details.get("paypalEmail").trim())
			.build();
	}
}
