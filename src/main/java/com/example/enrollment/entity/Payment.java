package com.example.enrollment.entity;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 시도 1건. 수강 신청 하나에 여러 건이 쌓일 수 있고(실패 후 재결제),
 * PENDING -> COMPLETED | FAILED | CANCELLED 이후로는 변경되지 않습니다.
 */
@Entity
@Table(
	name = "payments",
	indexes = {
		@Index(name = "idx_payments_enrollment_id", columnList = "enrollment_id"),
		@Index(name = "idx_payments_status", columnList = "status")
	}
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Payment {

	// PG 응답을 기다리다 실패 처리한 결제의 오류 코드. PG에서는 승인되었을 수 있습니다.
	public static final String GATEWAY_TIMEOUT = "GATEWAY_TIMEOUT";

	@Id
	@GeneratedValue(strategy = GenerationType.UUID)
	@Column(length = 36)
	private String id;

	@Column(name = "enrollment_id", nullable = false, length = 36, updatable = false)
	private String enrollmentId;

	@Column(name = "user_id", nullable = false, updatable = false)
	private Long userId;

	@Enumerated(EnumType.STRING)
	@Column(name = "payment_method", nullable = false, length = 20, updatable = false)
	private PaymentMethod paymentMethod;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private PaymentStatus status;

	@Column(nullable = false, precision = 10, scale = 2, updatable = false)
	private BigDecimal amount;

	@Column(nullable = false, length = 3, updatable = false)
	private String currency;

	@Column(name = "transaction_id")
	private String transactionId;

	@Column(name = "gateway_response", columnDefinition = "TEXT")
	private String gatewayResponse;

	@Column(name = "payment_gateway", length = 50)
	private String paymentGateway;

	@Embedded
	private MaskedPaymentDetails details;

	@Column(name = "error_code", length = 50)
	private String errorCode;

	@Column(name = "error_message", columnDefinition = "TEXT")
	private String errorMessage;

	@Column(name = "created_at", nullable = false, updatable = false)
	private LocalDateTime createdAt;

	@Column(name = "processed_at")
	private LocalDateTime processedAt;

	// 응답 시간 초과 결제의 PG 결제내역 확인 시각 (null이면 미확인)
	@Column(name = "gateway_checked_at")
	private LocalDateTime gatewayCheckedAt;

	public static Payment create(String enrollmentId, Long userId, PaymentMethod paymentMethod,
		BigDecimal amount, String currency, MaskedPaymentDetails details) {
		Payment payment = new Payment();
		payment.enrollmentId = enrollmentId;
		payment.userId = userId;
		payment.paymentMethod = paymentMethod;
		payment.amount = amount;
		payment.currency = currency;
		payment.details = details;
		payment.status = PaymentStatus.PENDING;
		return payment;
	}

	public void markCompleted(String transactionId, String gatewayResponse, String paymentGateway, LocalDateTime now) {
		requirePending(PaymentStatus.COMPLETED);
		this.status = PaymentStatus.COMPLETED;
		this.transactionId = transactionId;
		this.gatewayResponse = gatewayResponse;
		this.paymentGateway = paymentGateway;
		this.errorCode = null;
		this.errorMessage = null;
		this.processedAt = now;
	}

	public void markFailed(String errorCode, String errorMessage, String gatewayResponse, String paymentGateway,
		LocalDateTime now) {
		requirePending(PaymentStatus.FAILED);
		this.status = PaymentStatus.FAILED;
		this.errorCode = errorCode;
		this.errorMessage = errorMessage;
		this.gatewayResponse = gatewayResponse;
		this.paymentGateway = paymentGateway;
		this.processedAt = now;
	}

	public void markCancelled(LocalDateTime now) {
		requirePending(PaymentStatus.CANCELLED);
		this.status = PaymentStatus.CANCELLED;
		this.processedAt = now;
	}

	/**
	 * 응답 시간 초과로 실패 처리한 결제가 뒤늦게 PG에서 승인된 경우.
	 * 상태는 FAILED로 유지하고 실제 출금 정보만 남겨 환불 대상으로 삼습니다.
	 */
	public void recordLateApproval(String transactionId, String gatewayResponse, LocalDateTime now) {
		requireAwaitingGatewayCheck();
		this.transactionId = transactionId;
		this.gatewayResponse = gatewayResponse;
		this.gatewayCheckedAt = now;
	}

	public void markGatewayChecked(LocalDateTime now) {
		requireAwaitingGatewayCheck();
		this.gatewayCheckedAt = now;
	}

	public boolean isPending() {
		return status == PaymentStatus.PENDING;
	}

	public boolean isAwaitingGatewayCheck() {
		return status == PaymentStatus.FAILED && GATEWAY_TIMEOUT.equals(errorCode) && gatewayCheckedAt == null;
	}

	@PrePersist
	void onCreate() {
		this.createdAt = LocalDateTime.now();
	}

	private void requireAwaitingGatewayCheck() {
		if (!isAwaitingGatewayCheck()) {
			throw new BusinessException(ErrorCode.INVALID_TRANSITION,
				"PG 확인 대상 결제가 아닙니다: " + status + ", errorCode=" + errorCode);
		}
	}

	private void requirePending(PaymentStatus target) {
		if (status != PaymentStatus.PENDING) {
			throw new BusinessException(ErrorCode.INVALID_TRANSITION,
				"종료된 결제는 상태를 변경할 수 없습니다: " + status + " -> " + target);
		}
	}
}
