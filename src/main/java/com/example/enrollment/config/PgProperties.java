package com.example.enrollment.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * PG 연동 설정. mock.* 값은 prod 이외 프로필의 MockPgApiClient에서만 사용합니다.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "pg")
public class PgProperties {

	private String baseUrl = "http://localhost:9090";

	private Duration connectTimeout = Duration.ofSeconds(2);

	private Duration readTimeout = Duration.ofSeconds(5);

	private int executorPoolSize = 8;

	private final Mock mock = new Mock();

	@Getter
	@Setter
	public static class Mock {

		/** 이 카드번호는 항상 거절 (CARD_DECLINED) */
		private String declineCardNumber = "4000000000000002";

		/** 이 PayPal 계정은 항상 거절 (PAYPAL_DECLINED) */
		private String declinePaypalEmail = "declined@example.com";

		/** 결제내역 조회용으로 보관하는 최근 승인 결과 수 */
		private int maxTrackedPayments = 10_000;
	}
}
