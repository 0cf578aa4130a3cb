package com.example.enrollment.application.service;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.config.EnrollmentProperties;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.repository.EnrollmentRepository;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ActivationRetryScheduler {

	private final EnrollmentRepository enrollmentRepository;
	private final ActivationService activationService;
	private final EnrollmentProperties enrollmentProperties;

	/**
	 * 재시도 시각이 된 ACTIVATING 수강 신청을 다시 활성화합니다.
	 * 대상 여부는 retryActivation에서 행 잠금 후 다시 확인하므로 여러 인스턴스가 동시에 돌아도 중복 활성화되지 않습니다.
	 */
	@Scheduled(fixedDelayString = "${enrollment.activation.retry-poll-delay-ms:60000}",
		initialDelayString = "${enrollment.activation.retry-poll-initial-delay-ms:60000}")
	public void retryDueActivations() {
		List<String> candidates = enrollmentRepository.findActivationRetryCandidates(EnrollmentStatus.ACTIVATING,
			LocalDateTime.now(), PageRequest.of(0, enrollmentProperties.getActivation().getRetryBatchSize()));
		if (candidates.isEmpty()) {
			return;
		}
		log.info("Retrying {} due course activations", candidates.size());

		for (String enrollmentId : candidates) {
			try {
				activationService.retryActivation(enrollmentId);
			} catch (BusinessException e) {
				// 조회 이후 다른 워커가 처리한 경우
				log.debug("Skipping activation retry: enrollmentId={}, code={}", enrollmentId, e.getCode());
			} catch (Exception e) {
				log.error("Error retrying activation for enrollmentId: {}", enrollmentId, e);
			}
		}
	}
}
