package com.example.enrollment.application.service;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.config.EnrollmentProperties;
import com.example.enrollment.entity.Course;
import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import com.example.enrollment.entity.PaymentStatus;
import com.example.enrollment.repository.CourseRepository;
import com.example.enrollment.repository.EnrollmentRepository;
import com.example.enrollment.repository.StudentRepository;
import com.example.enrollment.web.controller.dto.EnrollmentRequest;
import com.example.enrollment.web.controller.dto.RegistrationResponse;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class EnrollmentService {

	private static final Pattern EMAIL_PATTERN = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
	private static final Pattern FULL_NAME_PATTERN = Pattern.compile("^[\\p{L} '\\-]+$");
	private static final int EMAIL_MAX_LENGTH = 255;
	private static final int FULL_NAME_MIN_LENGTH = 2;
	private static final int FULL_NAME_MAX_LENGTH = 100;

	private final EnrollmentRepository enrollmentRepository;
	private final CourseRepository courseRepository;
	private final StudentRepository studentRepository;
	private final CouponService couponService;
	private final EnrollmentProperties enrollmentProperties;

	/**
	 * 수강 신청
	 * 쿠폰 사용과 수강 신청 저장은 하나의 트랜잭션입니다. 어느 단계에서든 실패하면 아무것도 남지 않습니다.
	 * 동시에 같은 강의를 신청한 경우 유니크 제약 위반을 DUPLICATE_ENROLLMENT로 변환합니다.
	 */
	@Transactional
	public RegistrationResponse register(Long userId, EnrollmentRequest request) {
		validateRegistration(userId, request);

		Course course = courseRepository.findById(request.getCourseId())
			.orElseThrow(() -> new BusinessException(ErrorCode.COURSE_NOT_FOUND));
		if (!studentRepository.existsById(userId)) {
			throw new BusinessException(ErrorCode.USER_NOT_FOUND);
		}
		if (enrollmentRepository.existsByUserIdAndCourseId(userId, course.getId())) {
			throw new BusinessException(ErrorCode.DUPLICATE_ENROLLMENT);
		}

		BigDecimal orderAmount = course.getPrice();
		String discountCode = null;
		BigDecimal discount = BigDecimal.ZERO;
		if (request.getDiscountCode() != null && !request.getDiscountCode().isBlank()) {
			CouponValidationResult validation = couponService.validate(request.getDiscountCode(), userId, orderAmount);
			if (!validation.isValid()) {
				throw new BusinessException(ErrorCode.INVALID_DISCOUNT, validation.getMessage());
			}
			discountCode = validation.getCoupon().getCode();
			discount = couponService.apply(validation.getCoupon(), userId, orderAmount);
		}

		Enrollment enrollment = Enrollment.create(userId, course.getId(), request.getFullName(), request.getEmail(),
			orderAmount, discountCode, discount, enrollmentProperties.getActivation().getMaxRetries(),
			LocalDateTime.now());
		try {
			enrollment = enrollmentRepository.saveAndFlush(enrollment);
		} catch (DataIntegrityViolationException e) {
			log.warn("Concurrent duplicate enrollment rejected: userId={}, courseId={}", userId, course.getId());
			throw new BusinessException(ErrorCode.DUPLICATE_ENROLLMENT, ErrorCode.DUPLICATE_ENROLLMENT.getMessage(), e);
		}

		log.info("Enrollment registered: enrollmentId={}, userId={}, courseId={}, status={}, finalAmount={}",
			enrollment.getId(), userId, course.getId(), enrollment.getStatus(), enrollment.getFinalAmount());
		return RegistrationResponse.from(enrollment);
	}

	/**
	 * 행 잠금 후 상태 전이
	 */
	@Transactional
	public Enrollment transition(String enrollmentId, EnrollmentStatus newStatus, PaymentStatus newPaymentStatus) {
		Enrollment enrollment = getForUpdate(enrollmentId);
		EnrollmentStatus before = enrollment.getStatus();
		enrollment.transition(newStatus, newPaymentStatus, LocalDateTime.now());
		log.info("Enrollment transitioned: enrollmentId={}, {} -> {}", enrollmentId, before, newStatus);
		return enrollment;
	}

	/**
	 * 수강 취소. 진행 중인 결제는 여기서 건드리지 않고 3단계(또는 결제 보정)에서 마무리됩니다.
	 */
	@Transactional
	public Enrollment cancel(String enrollmentId) {
		Enrollment enrollment = getForUpdate(enrollmentId);
		PaymentStatus paymentStatus = enrollment.getPaymentStatus() == PaymentStatus.COMPLETED
			? null
			: PaymentStatus.CANCELLED;
		enrollment.transition(EnrollmentStatus.CANCELLED, paymentStatus, LocalDateTime.now());
		log.info("Enrollment cancelled: enrollmentId={}, userId={}, courseId={}",
			enrollmentId, enrollment.getUserId(), enrollment.getCourseId());
		return enrollment;
	}

	Enrollment getForUpdate(String enrollmentId) {
		return enrollmentRepository.findByIdForUpdate(enrollmentId)
			.orElseThrow(() -> new BusinessException(ErrorCode.ENROLLMENT_NOT_FOUND));
	}

	private void validateRegistration(Long userId, EnrollmentRequest request) {
		if (userId == null) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "사용자 정보가 필요합니다");
		}
		if (request.getCourseId() == null) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "강의 ID는 필수입니다");
		}

		String fullName = request.getFullName() == null ? "" : request.getFullName().trim();
		if (fullName.length() < FULL_NAME_MIN_LENGTH || fullName.length() > FULL_NAME_MAX_LENGTH) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "이름은 2자 이상 100자 이하여야 합니다");
		}
		if (!FULL_NAME_PATTERN.matcher(fullName).matches()) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "이름에는 문자, 공백, 하이픈, 아포스트로피만 사용할 수 있습니다");
		}

		String email = request.getEmail() == null ? "" : request.getEmail().trim();
		if (email.isEmpty() || email.length() > EMAIL_MAX_LENGTH || !EMAIL_PATTERN.matcher(email).matches()) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "이메일 형식이 올바르지 않습니다");
		}
	}
}
