package com.example.enrollment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * PG 입출금 원장 (append-only)
 */
@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentTransaction {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(name = "payment_id", nullable = false, length = 36)
	private String paymentId;

	@Enumerated(EnumType.STRING)
	@Column(name = "transaction_type", nullable = false, length = 20)
	private TransactionType type;

	@Column(name = "external_transaction_id")
	private String externalTransactionId;

	@Column(nullable = false, precision = 10, scale = 2)
	private BigDecimal amount;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private TransactionStatus status;

	@Column(name = "gateway_response", columnDefinition = "TEXT")
	private String gatewayResponse;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	public static PaymentTransaction charge(Payment payment, LocalDateTime now) {
		return of(payment.getId(), TransactionType.CHARGE, payment.getTransactionId(), payment.getAmount(),
			TransactionStatus.SUCCEEDED, payment.getGatewayResponse(), now);
	}

	public static PaymentTransaction refund(Payment payment, TransactionStatus status, String externalTransactionId,
		String gatewayResponse, LocalDateTime now) {
		return of(payment.getId(), TransactionType.REFUND, externalTransactionId, payment.getAmount(),
			status, gatewayResponse, now);
	}

	private static PaymentTransaction of(String paymentId, TransactionType type, String externalTransactionId,
		BigDecimal amount, TransactionStatus status, String gatewayResponse, LocalDateTime now) {
		PaymentTransaction tx = new PaymentTransaction();
		tx.paymentId = paymentId;
		tx.type = type;
		tx.externalTransactionId = externalTransactionId;
		tx.amount = amount;
		tx.status = status;
		tx.gatewayResponse = gatewayResponse;
		tx.createdAt = now;
		return tx;
	}
}
