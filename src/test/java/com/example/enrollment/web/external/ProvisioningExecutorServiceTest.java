package com.example.enrollment.web.external;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.enrollment.config.EnrollmentProperties;
import com.example.enrollment.entity.Enrollment;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

class ProvisioningExecutorServiceTest {

	private ThreadPoolTaskExecutor executor;
	private CourseProvisioningClient courseProvisioningClient;
	private ProvisioningExecutorService provisioningExecutorService;
	private Enrollment enrollment;

	@BeforeEach
	void setUp() {
		executor = new ThreadPoolTaskExecutor();
		executor.setCorePoolSize(2);
		executor.setMaxPoolSize(2);
		executor.setThreadNamePrefix("lms-test-");
		executor.initialize();

		courseProvisioningClient = mock(CourseProvisioningClient.class);
		EnrollmentProperties properties = new EnrollmentProperties();
		properties.getActivation().setProvisioningTimeout(Duration.ofMillis(200));
		provisioningExecutorService = new ProvisioningExecutorService(executor, courseProvisioningClient, properties);

		enrollment = Enrollment.create(1L, 10L, "Jane Doe", "jane@example.com",
			new BigDecimal("100.00"), null, BigDecimal.ZERO, 3, LocalDateTime.now());
	}

	@AfterEach
	void tearDown() {
		executor.shutdown();
	}

	@Test
	void provision_returnsClientResult() {
		when(courseProvisioningClient.provision(enrollment)).thenReturn(true, false);

		assertThat(provisioningExecutorService.provision(enrollment)).isTrue();
		assertThat(provisioningExecutorService.provision(enrollment)).isFalse();
	}

	/**
	 * 타임아웃이면 false, 실행 중인 호출은 인터럽트됩니다.
	 */
	@Test
	void provision_timeout() throws InterruptedException {
		CountDownLatch interrupted = new CountDownLatch(1);
		when(courseProvisioningClient.provision(enrollment)).thenAnswer(invocation -> {
			try {
				Thread.sleep(5_000);
			} catch (InterruptedException e) {
				interrupted.countDown();
				throw e;
			}
			return true;
		});

		assertThat(provisioningExecutorService.provision(enrollment)).isFalse();
		assertThat(interrupted.await(1, TimeUnit.SECONDS)).isTrue();
	}

	@Test
	void provision_clientThrows() {
		when(courseProvisioningClient.provision(enrollment)).thenThrow(new IllegalStateException("LMS down"));

		assertThat(provisioningExecutorService.provision(enrollment)).isFalse();
	}
}
