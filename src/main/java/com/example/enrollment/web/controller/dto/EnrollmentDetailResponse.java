package com.example.enrollment.web.controller.dto;

import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class EnrollmentDetailResponse {

	private final EnrollmentResponse enrollment;
	private final CourseSummary course;
	private final ProgressSummary progress;
	private final boolean canRetryActivation;
	private final List<PaymentResponse> payments;

	@Getter
	@Builder
	public static class CourseSummary {
		private final Long id;
		private final String title;
		private final int totalLessons;
	}

	@Getter
	@Builder
	public static class ProgressSummary {
		private final int completedLessons;
		private final int totalLessons;
		private final double progressPercentage;
	}
}
