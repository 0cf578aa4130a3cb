package com.example.enrollment.web.external.gateway;

import com.example.enrollment.entity.MaskedPaymentDetails;
import com.example.enrollment.entity.PaymentMethod;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiExecutorService;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CreditCardPaymentGateway extends AbstractPaymentGateway {

	private static final List<String> REQUIRED_FIELDS = List.of("cardNumber", "cardExpiry", "cardCvv", "cardHolderName");

	public CreditCardPaymentGateway(PgApiClient pgApiClient, PgApiExecutorService pgApiExecutorService) {
		super(pgApiClient, pgApiExecutorService);
	}

	@Override
	public PaymentMethod getMethod() {
		return PaymentMethod.CREDIT_CARD;
	}

	@Override
	public String getName() {
		return "card-pg";
	}

	@Override
	protected List<String> requiredFields() {
		return REQUIRED_FIELDS;
	}

	// CVV, 유효기간은 저장하지 않음
	@Override
	public MaskedPaymentDetails maskedDetails(Map<String, String> details) {
		return MaskedPaymentDetails.builder()
			.lastFourDigits(lastFour(details.get("cardNumber")))
			.cardHolderName(details.get("cardHolderName").trim())
			.build();
	}
}
