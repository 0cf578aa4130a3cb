package com.example.enrollment.application.service;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.entity.Course;
import com.example.enrollment.entity.CourseProgress;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.repository.CourseProgressRepository;
import com.example.enrollment.repository.CourseRepository;
import com.example.enrollment.repository.EnrollmentRepository;
import com.example.enrollment.repository.PaymentRepository;
import com.example.enrollment.web.controller.dto.CourseAccessResponse;
import com.example.enrollment.web.controller.dto.EnrollmentDetailResponse;
import com.example.enrollment.web.controller.dto.EnrollmentResponse;
import com.example.enrollment.web.controller.dto.PagedResponse;
import com.example.enrollment.web.controller.dto.PaymentResponse;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class EnrollmentQueryService {

	private static final int DEFAULT_LIMIT = 10;
	private static final int MAX_LIMIT = 100;

	private final EnrollmentRepository enrollmentRepository;
	private final CourseRepository courseRepository;
	private final CourseProgressRepository courseProgressRepository;
	private final PaymentRepository paymentRepository;

	public EnrollmentDetailResponse getEnrollmentDetail(String enrollmentId) {
		Enrollment enrollment = enrollmentRepository.findById(enrollmentId)
			.orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));
		Optional<Course> course = courseRepository.findById(enrollment.getCourseId());
		int totalLessons = course.map(Course::getTotalLessons).orElse(0);
		int completedLessons = courseProgressRepository
			.findByUserIdAndCourseId(enrollment.getUserId(), enrollment.getCourseId())
			.map(CourseProgress::getCompletedLessons)
			.orElse(0);

		return EnrollmentDetailResponse.builder()
			.enrollment(EnrollmentResponse.from(enrollment))
			.course(course.map(c -> EnrollmentDetailResponse.CourseSummary.builder()
				.id(c.getId())
				.title(c.getTitle())
				.totalLessons(c.getTotalLessons())
				.build())
				.orElse(null))
			.progress(EnrollmentDetailResponse.ProgressSummary.builder()
				.completedLessons(completedLessons)
				.totalLessons(totalLessons)
				.progressPercentage(progressPercentage(completedLessons, totalLessons))
				.build())
			.canRetryActivation(enrollment.canRetryActivation(LocalDateTime.now()))
			.payments(paymentRepository.findByEnrollmentIdOrderByCreatedAtDesc(enrollmentId).stream()
				.map(PaymentResponse::from)
				.collect(Collectors.toList()))
			.build();
	}

	/**
	 * 사용자 수강 목록 (신청일 최신순). page는 1부터, limit은 1~100으로 보정합니다.
	 */
	public PagedResponse<EnrollmentResponse> getUserEnrollments(Long userId, String status, Integer page, Integer limit) {
		int pageNumber = page == null || page < 1 ? 1 : page;
		int pageSize = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(limit, MAX_LIMIT));
		Pageable pageable = PageRequest.of(pageNumber - 1, pageSize, Sort.by(Sort.Direction.DESC, "enrollmentDate"));

		Page<Enrollment> enrollments;
		if (status == null || status.isBlank()) {
			enrollments = enrollmentRepository.findByUserId(userId, pageable);
		} else {
			enrollments = enrollmentRepository.findByUserIdAndStatus(userId, parseStatus(status), pageable);
		}
		return PagedResponse.of(enrollments, EnrollmentResponse::from);
	}

	public CourseAccessResponse checkCourseAccess(Long userId, Long courseId) {
		Optional<Enrollment> found = enrollmentRepository.findByUserIdAndCourseId(userId, courseId);
		if (found.isEmpty()) {
			return CourseAccessResponse.builder()
				.hasAccess(false)
				.reasonCode(CourseAccessResponse.NOT_ENROLLED)
				.message("User is not enrolled in this course")
				.build();
		}

		Enrollment enrollment = found.get();
		if (enrollment.hasCourseAccess()) {
			int completedLessons = courseProgressRepository.findByUserIdAndCourseId(userId, courseId)
				.map(CourseProgress::getCompletedLessons)
				.orElse(0);
			return CourseAccessResponse.builder()
				.hasAccess(true)
				.enrollmentStatus(enrollment.getStatus())
				.nextLessonUrl("/courses/" + courseId + "/lessons/" + (completedLessons + 1))
				.build();
		}

		boolean paymentPending = enrollment.getStatus() == EnrollmentStatus.PENDING
			|| enrollment.getStatus() == EnrollmentStatus.PAYMENT_PENDING;
		return CourseAccessResponse.builder()
			.hasAccess(false)
			.enrollmentStatus(enrollment.getStatus())
			.reasonCode(paymentPending ? CourseAccessResponse.PAYMENT_PENDING : CourseAccessResponse.ENROLLMENT_EXPIRED)
			.message(paymentPending ? "Payment is pending" : "Enrollment is no longer active")
			.build();
	}

	private EnrollmentStatus parseStatus(String status) {
		String normalized = status.trim().toUpperCase();
		return Arrays.stream(EnrollmentStatus.values())
			.filter(s -> s.name().equals(normalized))
			.findFirst()
			.orElseThrow(() -> new BusinessException(ErrorCode.VALIDATION_ERROR, "알 수 없는 수강 상태입니다: " + status));
	}

	private double progressPercentage(int completedLessons, int totalLessons) {
		if (totalLessons <= 0) {
			return 0.0;
		}
		return BigDecimal.valueOf(completedLessons * 100L)
			.divide(BigDecimal.valueOf(totalLessons), 1, RoundingMode.HALF_UP)
			.doubleValue();
	}
}
