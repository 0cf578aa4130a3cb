package com.example.enrollment.web.external.gateway;

import com.example.enrollment.entity.MaskedPaymentDetails;
import com.example.enrollment.entity.PaymentMethod;
import com.example.enrollment.web.external.PgApiClient;
import com.example.enrollment.web.external.PgApiExecutorService;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class BankTransferPaymentGateway extends AbstractPaymentGateway {

	private static final List<String> REQUIRED_FIELDS = List.of("accountNumber", "bankCode");

	public BankTransferPaymentGateway(PgApiClient pgApiClient, PgApiExecutorService pgApiExecutorService) {
		super(pgApiClient, pgApiExecutorService);
	}

	@Override
	public PaymentMethod getMethod() {
		return PaymentMethod.BANK_TRANSFER;
	}

	@Override
	public String getName() {
		return "bank-transfer";
	}

	@Override
	protected List<String> requiredFields() {
		return REQUIRED_FIELDS;
	}

	@Override
	public MaskedPaymentDetails maskedDetails(Map<String, String> details) {
		return MaskedPaymentDetails.builder()
			.bankAccountLastFour(lastFour(details.get("accountNumber")))
			.bankCode(details.get("bankCode").trim())
			.build();
	}
}
