package com.example.enrollment.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Entity
@Table(name = "coupon_usage", indexes = @Index(name = "idx_coupon_usage_coupon_user", columnList = "coupon_id, user_id"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class CouponUsage {

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(name = "coupon_id", nullable = false)
	private Long couponId;

	@Column(name = "user_id", nullable = false)
	private Long userId;

	@Column(name = "order_amount", nullable = false, precision = 10, scale = 2)
	private BigDecimal orderAmount;

	@Column(name = "discount_amount", nullable = false, precision = 10, scale = 2)
	private BigDecimal discountAmount;

	@Column(name = "used_at", nullable = false)
	private LocalDateTime usedAt;

	public static CouponUsage of(Long couponId, Long userId, BigDecimal orderAmount, BigDecimal discountAmount,
		LocalDateTime usedAt) {
		CouponUsage usage = new CouponUsage();
		usage.couponId = couponId;
		usage.userId = userId;
		usage.orderAmount = orderAmount;
		usage.discountAmount = discountAmount;
		usage.usedAt = usedAt;
		return usage;
	}
}
