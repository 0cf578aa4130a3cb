package com.example.enrollment.application.event;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

/**
 * 강의 활성화 재시도 소진. 수강 신청은 ACTIVATING으로 남고 운영자 확인이 필요합니다.
 */
@Getter
public class ActivationExhaustedEvent extends ApplicationEvent {
	private final String enrollmentId;
	private final Long userId;
	private final Long courseId;
	private final int attempts;

	public ActivationExhaustedEvent(Object source, String enrollmentId, Long userId, Long courseId, int attempts) {
		super(source);
		this.enrollmentId = enrollmentId;
		this.userId = userId;
		this.courseId = courseId;
		this.attempts = attempts;
	}
}
