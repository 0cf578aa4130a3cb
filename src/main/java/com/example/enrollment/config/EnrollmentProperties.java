package com.example.enrollment.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 수강 신청/결제/활성화 설정
 * <pre>
 * enrollment:
 *   activation:
 *     max-retries: 3
 *     backoff-base: 5m
 *     backoff-max: 15m
 *     provisioning-timeout: 10s
 *   payment:
 *     currency: VND
 *     gateway-timeout: 5s
 * </pre>
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "enrollment")
public class EnrollmentProperties {

	private final Activation activation = new Activation();
	private final Payment payment = new Payment();

	@Getter
	@Setter
	public static class Activation {

		/** 신규 수강 신청에 기록되는 최대 활성화 시도 횟수 */
		private int maxRetries = 3;

		/** 첫 실패 후 대기 시간, 이후 실패마다 2배 */
		private Duration backoffBase = Duration.ofMinutes(5);

		/** 대기 시간 상한 */
		private Duration backoffMax = Duration.ofMinutes(15);

		/** 재시도 스케줄러 1회 처리 건수 */
		private int retryBatchSize = 50;

		/** LMS 프로비저닝 호출 타임아웃. 초과 시 실패한 시도로 기록 */
		private Duration provisioningTimeout = Duration.ofSeconds(10);
	}

	@Getter
	@Setter
	public static class Payment {

		private String currency = "VND";

		/** PG 호출 타임아웃. 초과 시 GATEWAY_TIMEOUT 실패로 기록 */
		private Duration gatewayTimeout = Duration.ofSeconds(5);

		/** 이 시간 이상 PENDING으로 남은 결제는 보정 대상 */
		private Duration adjustmentThreshold = Duration.ofMinutes(5);

		/** 기동 시 미완료 결제 보정 실행 여부 */
		private boolean adjustOnStartup = true;
	}
}
