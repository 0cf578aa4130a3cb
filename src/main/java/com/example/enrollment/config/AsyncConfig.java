package com.example.enrollment.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * 비동기 이벤트 리스너, PG 호출, LMS 프로비저닝 스레드풀을 분리합니다.
 */
@Configuration
public class AsyncConfig {

	// @Async 기본 실행기 (이름으로 조회됨)
	@Bean(name = "taskExecutor")
	public ThreadPoolTaskExecutor taskExecutor() {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(4);
		executor.setMaxPoolSize(8);
		executor.setQueueCapacity(500);
		executor.setThreadNamePrefix("enrollment-async-");
		return executor;
	}

	@Bean(name = "pgApiExecutor")
	public ThreadPoolTaskExecutor pgApiExecutor(PgProperties pgProperties) {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(pgProperties.getExecutorPoolSize());
		executor.setMaxPoolSize(pgProperties.getExecutorPoolSize());
		executor.setQueueCapacity(100);
		executor.setThreadNamePrefix("pg-api-");
		executor.setWaitForTasksToCompleteOnShutdown(true);
		return executor;
	}

	@Bean(name = "provisioningExecutor")
	public ThreadPoolTaskExecutor provisioningExecutor() {
		ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(4);
		executor.setMaxPoolSize(4);
		executor.setQueueCapacity(100);
		executor.setThreadNamePrefix("lms-provisioning-");
		return executor;
	}
}
