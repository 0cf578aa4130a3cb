package com.example.enrollment.web.controller.dto;

import java.time.LocalDateTime;
import lombok.Builder;
import lombok.Getter;

/**
 * 강의 활성화 시도 결과
 * 실패 시 retryAvailable이 true면 estimatedCompletion(다음 재시도 예정 시각)에 자동 재시도됩니다.
 */
@Getter
@Builder
public class ActivationResult {

	private final String enrollmentId;
	private final boolean granted;
	private final boolean accessGranted;
	private final String firstLessonUrl;
	private final boolean retryAvailable;
	private final LocalDateTime estimatedCompletion;
	private final LocalDateTime activationTime;
	private final int activationAttempts;
	private final String message;
}
