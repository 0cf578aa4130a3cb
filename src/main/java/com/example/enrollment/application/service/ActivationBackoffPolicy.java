package com.example.enrollment.application.service;

import com.example.enrollment.config.EnrollmentProperties;
import java.time.Duration;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 활성화 재시도 간격: min(base * 2^(attempt-1), max)
 * 기본값 기준 1회 실패 5분, 2회 10분, 3회 이상 15분
 */
@Component
@RequiredArgsConstructor
public class ActivationBackoffPolicy {

	private final EnrollmentProperties enrollmentProperties;

	public Duration backoffFor(int attempt) {
		Duration base = enrollmentProperties.getActivation().getBackoffBase();
		Duration max = enrollmentProperties.getActivation().getBackoffMax();
		if (attempt <= 1) {
			return base.compareTo(max) > 0 ? max : base;
		}
		Duration delay = base;
		for (int i = 1; i < attempt; i++) {
			delay = delay.multipliedBy(2);
			if (delay.compareTo(max) >= 0) {
				return max;
			}
		}
		return delay;
	}

	public LocalDateTime nextRetryAt(LocalDateTime now, int attempt) {
		return now.plus(backoffFor(attempt));
	}
}
