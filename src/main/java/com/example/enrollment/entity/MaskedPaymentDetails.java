package com.example.enrollment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 수단별 최소 정보. 카드번호 전체나 CVV는 저장하지 않습니다.
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MaskedPaymentDetails {

	@Column(name = "last_four_digits", length = 4)
	private String lastFourDigits;

	@Column(name = "card_holder_name")
	private String cardHolderName;

	@Column(name = "paypal_email")
	private String paypalEmail;

	@Column(name = "bank_account_last_four", length = 4)
	private String bankAccountLastFour;

	@Column(name = "bank_code", length = 10)
	private String bankCode;
}
