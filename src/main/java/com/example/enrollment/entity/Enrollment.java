package com.example.enrollment.entity;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 수강 신청
 * 사용자-강의 쌍마다 하나만 존재하며(uk_enrollment_user_course), 삭제하지 않고 CANCELLED 상태로 남깁니다.
 * 상태 변경은 {@link #transition(EnrollmentStatus, PaymentStatus, LocalDateTime)}을 통해서만 이루어집니다.
 */
@Entity
@Table(
	name = "enrollments",
	uniqueConstraints = @UniqueConstraint(name = "uk_enrollment_user_course", columnNames = {"user_id", "course_id"}),
	indexes = {
		@Index(name = "idx_enrollments_status", columnList = "status"),
		@Index(name = "idx_enrollments_user_id", columnList = "user_id")
	}
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Enrollment {

	@Id
	@GeneratedValue(strategy = GenerationType.UUID)
	@Column(length = 36)
	private String id;

	@Column(name = "user_id", nullable = false, updatable = false)
	private Long userId;

	@Column(name = "course_id", nullable = false, updatable = false)
	private Long courseId;

	// 신청 시점의 이름/이메일 (프로필 변경과 무관)
	@Column(name = "full_name", nullable = false, length = 200, updatable = false)
	private String fullName;

	@Column(nullable = false, updatable = false)
	private String email;

	@Column(name = "payment_amount", nullable = false, precision = 10, scale = 2, updatable = false)
	private BigDecimal paymentAmount;

	@Column(name = "discount_code", length = 50, updatable = false)
	private String discountCode;

	@Column(name = "discount_applied", nullable = false, precision = 10, scale = 2, updatable = false)
	private BigDecimal discountApplied;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private EnrollmentStatus status;

	@Enumerated(EnumType.STRING)
	@Column(name = "payment_status", nullable = false, length = 20)
	private PaymentStatus paymentStatus;

	@Column(name = "access_granted", nullable = false)
	private boolean accessGranted;

	@Column(name = "enrollment_date", nullable = false, updatable = false)
	private LocalDateTime enrollmentDate;

	@Column(name = "activation_date")
	private LocalDateTime activationDate;

	@Column(name = "activation_attempts", nullable = false)
	private int activationAttempts;

	@Column(name = "max_retries", nullable = false)
	private int maxRetries;

	@Column(name = "next_retry_at")
	private LocalDateTime nextRetryAt;

	@Column(name = "created_at", nullable = false, updatable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	@Version
	private Long version;

	/**
	 * 최종 결제 금액이 0이면 결제 없이 바로 ENROLLED(접근 허용, 결제 COMPLETED)로 생성됩니다.
	 */
	public static Enrollment create(Long userId, Long courseId, String fullName, String email,
		BigDecimal paymentAmount, String discountCode, BigDecimal discountApplied,
		int maxRetries, LocalDateTime now) {
		Enrollment enrollment = new Enrollment();
		enrollment.userId = userId;
		enrollment.courseId = courseId;
		enrollment.fullName = fullName.trim();
		enrollment.email = email.trim();
		enrollment.paymentAmount = nonNegative(paymentAmount);
		enrollment.discountCode = discountCode;
		enrollment.discountApplied = nonNegative(discountApplied);
		enrollment.maxRetries = maxRetries;
		enrollment.activationAttempts = 0;
		enrollment.enrollmentDate = now;

		if (enrollment.isPaymentRequired()) {
			enrollment.status = EnrollmentStatus.PAYMENT_PENDING;
			enrollment.paymentStatus = PaymentStatus.PENDING;
			enrollment.accessGranted = false;
		} else {
			enrollment.status = EnrollmentStatus.ENROLLED;
			enrollment.paymentStatus = PaymentStatus.COMPLETED;
			enrollment.accessGranted = true;
			enrollment.activationDate = now;
		}
		return enrollment;
	}

	public BigDecimal getFinalAmount() {
		return paymentAmount.subtract(discountApplied).max(BigDecimal.ZERO);
	}

	public boolean isPaymentRequired() {
		return getFinalAmount().signum() > 0;
	}

	/**
	 * 상태 전이. ENROLLED/ACTIVE 진입 시 접근 허용, CANCELLED 진입 시 접근 회수.
	 * activationDate는 최초 진입 시에만 기록합니다.
	 */
	public void transition(EnrollmentStatus newStatus, PaymentStatus newPaymentStatus, LocalDateTime now) {
		if (!status.canTransitionTo(newStatus)) {
			throw new BusinessException(ErrorCode.INVALID_TRANSITION,
				"허용되지 않는 상태 변경입니다: " + status + " -> " + newStatus);
		}
		this.status = newStatus;
		if (newStatus == EnrollmentStatus.ENROLLED || newStatus == EnrollmentStatus.ACTIVE) {
			this.accessGranted = true;
			if (this.activationDate == null) {
				this.activationDate = now;
			}
		} else if (newStatus == EnrollmentStatus.CANCELLED) {
			this.accessGranted = false;
			this.nextRetryAt = null;
		}
		if (newStatus == EnrollmentStatus.ACTIVE) {
			this.nextRetryAt = null;
		}
		if (newPaymentStatus != null) {
			this.paymentStatus = newPaymentStatus;
		}
	}

	public boolean isEligibleForActivation() {
		return (status == EnrollmentStatus.ENROLLED || status == EnrollmentStatus.ACTIVATING)
			&& paymentStatus == PaymentStatus.COMPLETED;
	}

	public int recordActivationFailure() {
		return ++activationAttempts;
	}

	public boolean hasActivationRetriesLeft() {
		return activationAttempts < maxRetries;
	}

	public void scheduleActivationRetry(LocalDateTime retryAt) {
		this.nextRetryAt = retryAt;
	}

	public boolean canRetryActivation(LocalDateTime now) {
		return hasActivationRetriesLeft()
			&& status == EnrollmentStatus.ACTIVATING
			&& (nextRetryAt == null || !now.isBefore(nextRetryAt));
	}

	/**
	 * ACTIVATING 상태에서도 이미 부여된 접근 권한은 유지됩니다.
	 */
	public boolean hasCourseAccess() {
		return accessGranted
			&& (status == EnrollmentStatus.ENROLLED
			|| status == EnrollmentStatus.ACTIVATING
			|| status == EnrollmentStatus.ACTIVE);
	}

	@PrePersist
	void onCreate() {
		LocalDateTime now = LocalDateTime.now();
		this.createdAt = now;
		this.updatedAt = now;
	}

	@PreUpdate
	void onUpdate() {
		this.updatedAt = LocalDateTime.now();
	}

	private static BigDecimal nonNegative(BigDecimal amount) {
		if (amount == null) {
			return BigDecimal.ZERO;
		}
		return amount.max(BigDecimal.ZERO);
	}
}
