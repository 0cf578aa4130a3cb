package com.example.enrollment.web.external;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class SlackApiClient {

	/**
	 * 운영자 알림 (모킹): 자동 처리로 복구할 수 없는 경우에만 호출됩니다.
	 * 환불 재시도 소진, 강의 활성화 재시도 소진
	 */
	public void sendSlackAlert(String message) {
		// 실제 구현 시 슬랙 웹훅 연동
		log.warn("Sending Slack alert: {}", message);
	}
}
