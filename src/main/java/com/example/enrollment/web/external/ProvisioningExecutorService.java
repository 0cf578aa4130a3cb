package com.example.enrollment.web.external;

import com.example.enrollment.config.EnrollmentProperties;
import com.example.enrollment.entity.Enrollment;
import java.time.Duration;
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
 * LMS 프로비저닝을 전용 스레드풀에서 타임아웃을 걸고 실행합니다.
 * 활성화는 수강 신청 행 잠금을 잡은 채 호출하므로 잠금 보유 시간이 타임아웃을 넘지 않습니다.
 * 타임아웃, 예외, 대기열 초과는 모두 false(일시적 실패)로 돌려줍니다.
 */
@Slf4j
@Service
public class ProvisioningExecutorService {

	private final ThreadPoolTaskExecutor provisioningExecutor;
	private final CourseProvisioningClient courseProvisioningClient;
	private final EnrollmentProperties enrollmentProperties;

	public ProvisioningExecutorService(@Qualifier("provisioningExecutor") ThreadPoolTaskExecutor provisioningExecutor,
		CourseProvisioningClient courseProvisioningClient, EnrollmentProperties enrollmentProperties) {
		this.provisioningExecutor = provisioningExecutor;
		this.courseProvisioningClient = courseProvisioningClient;
		this.enrollmentProperties = enrollmentProperties;
	}

	public boolean provision(Enrollment enrollment) {
		Duration timeout = enrollmentProperties.getActivation().getProvisioningTimeout();
		Future<Boolean> future;
		try {
			future = provisioningExecutor.submit(() -> courseProvisioningClient.provision(enrollment));
		} catch (TaskRejectedException e) {
			log.error("Provisioning executor rejected call: enrollmentId={}", enrollment.getId(), e);
			return false;
		}

		try {
			return Boolean.TRUE.equals(future.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
		} catch (TimeoutException e) {
			future.cancel(true);
			log.warn("Course provisioning timed out after {}ms: enrollmentId={}", timeout.toMillis(), enrollment.getId());
			return false;
		} catch (ExecutionException e) {
			Throwable cause = e.getCause() == null ? e : e.getCause();
			log.warn("Course provisioning threw: enrollmentId={}, message={}", enrollment.getId(), cause.getMessage());
			return false;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			future.cancel(true);
			log.warn("Course provisioning interrupted: enrollmentId={}", enrollment.getId());
			return false;
		}
	}
}
