package com.example.enrollment.web.controller;

import com.example.enrollment.application.orchestration.EnrollmentPaymentOrchestration;
import com.example.enrollment.application.service.ActivationService;
import com.example.enrollment.application.service.EnrollmentQueryService;
import com.example.enrollment.application.service.EnrollmentService;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.web.controller.dto.ActivationResult;
import com.example.enrollment.web.controller.dto.CourseAccessResponse;
import com.example.enrollment.web.controller.dto.EnrollmentDetailResponse;
import com.example.enrollment.web.controller.dto.EnrollmentRequest;
import com.example.enrollment.web.controller.dto.EnrollmentResponse;
import com.example.enrollment.web.controller.dto.PagedResponse;
import com.example.enrollment.web.controller.dto.PaymentRequest;
import com.example.enrollment.web.controller.dto.RegistrationResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 인증은 게이트웨이에서 처리되고 사용자 ID가 X-User-Id 헤더로 전달된다고 가정합니다.
 */
@RestController
@RequiredArgsConstructor
public class EnrollmentController {

	static final String USER_ID_HEADER = "X-User-Id";

	private final EnrollmentService enrollmentService;
	private final EnrollmentPaymentOrchestration enrollmentPaymentOrchestration;
	private final ActivationService activationService;
	private final EnrollmentQueryService enrollmentQueryService;

	@PostMapping("/enrollments")
	public ResponseEntity<RegistrationResponse> register(@RequestHeader(USER_ID_HEADER) Long userId,
		@RequestBody EnrollmentRequest request) {
		return ResponseEntity.status(HttpStatus.CREATED).body(enrollmentService.register(userId, request));
	}

	@PostMapping("/enrollments/{enrollmentId}/payments")
	public ResponseEntity<EnrollmentResponse> pay(@PathVariable String enrollmentId,
		@RequestBody PaymentRequest request) {
		Enrollment enrollment = enrollmentPaymentOrchestration.processPayment(enrollmentId, request);
		return ResponseEntity.ok(EnrollmentResponse.from(enrollment));
	}

	@PostMapping("/enrollments/{enrollmentId}/activate")
	public ResponseEntity<ActivationResult> activate(@PathVariable String enrollmentId) {
		return ResponseEntity.ok(activationService.activate(enrollmentId));
	}

	@PostMapping("/enrollments/{enrollmentId}/activate/retry")
	public ResponseEntity<ActivationResult> retryActivation(@PathVariable String enrollmentId) {
		return ResponseEntity.ok(activationService.retryActivation(enrollmentId));
	}

	@PostMapping("/enrollments/{enrollmentId}/cancel")
	public ResponseEntity<EnrollmentResponse> cancel(@PathVariable String enrollmentId) {
		return ResponseEntity.ok(EnrollmentResponse.from(enrollmentService.cancel(enrollmentId)));
	}

	@GetMapping("/enrollments/{enrollmentId}")
	public ResponseEntity<EnrollmentDetailResponse> getEnrollment(@PathVariable String enrollmentId) {
		return ResponseEntity.ok(enrollmentQueryService.getEnrollmentDetail(enrollmentId));
	}

	@GetMapping("/users/{userId}/enrollments")
	public ResponseEntity<PagedResponse<EnrollmentResponse>> getUserEnrollments(@PathVariable Long userId,
		@RequestParam(required = false) String status,
		@RequestParam(required = false) Integer page,
		@RequestParam(required = false) Integer limit) {
		return ResponseEntity.ok(enrollmentQueryService.getUserEnrollments(userId, status, page, limit));
	}

	@GetMapping("/courses/{courseId}/access")
	public ResponseEntity<CourseAccessResponse> checkCourseAccess(@PathVariable Long courseId,
		@RequestParam Long userId) {
		return ResponseEntity.ok(enrollmentQueryService.checkCourseAccess(userId, courseId));
	}
}
