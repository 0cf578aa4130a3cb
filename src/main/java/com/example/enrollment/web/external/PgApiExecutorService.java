package com.example.enrollment.web.external;

import com.example.enrollment.config.EnrollmentProperties;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * PG 호출은 전용 스레드풀에서 타임아웃을 걸고 실행합니다.
 * DB 트랜잭션 밖에서만 호출해야 합니다.
 */
@Slf4j
@Service
public class PgApiExecutorService {

	private final ThreadPoolTaskExecutor pgApiExecutor;
	private final EnrollmentProperties enrollmentProperties;

	public PgApiExecutorService(@Qualifier("pgApiExecutor") ThreadPoolTaskExecutor pgApiExecutor,
		EnrollmentProperties enrollmentProperties) {
		this.pgApiExecutor = pgApiExecutor;
		this.enrollmentProperties = enrollmentProperties;
	}

	/**
	 * @throws PgApiException 타임아웃(GATEWAY_TIMEOUT) 또는 호출 실패(GATEWAY_ERROR)
	 */
	public <T> T execute(String operation, Callable<T> apiCall) {
		Duration timeout = enrollmentProperties.getPayment().getGatewayTimeout();
		Future<T> future;
		try {
			future = pgApiExecutor.submit(apiCall);
		} catch (TaskRejectedException e) {
			log.error("PG executor rejected {} call", operation, e);
			throw new PgApiException(PgApiException.GATEWAY_ERROR, "PG 호출 대기열이 가득 찼습니다", e);
		}

		try {
			return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			log.warn("PG {} call timed out after {}ms", operation, timeout.toMillis());
			throw new PgApiException(PgApiException.GATEWAY_TIMEOUT, "PG 응답 시간이 초과되었습니다", e);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() == null ? e : e.getCause();
			log.warn("PG {} call failed: {}", operation, cause.getMessage());
			throw new PgApiException(PgApiException.GATEWAY_ERROR, "PG 호출에 실패했습니다: " + cause.getMessage(), cause);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			throw new PgApiException(PgApiException.GATEWAY_ERROR, "PG 호출이 중단되었습니다", e);
		}
	}
}
