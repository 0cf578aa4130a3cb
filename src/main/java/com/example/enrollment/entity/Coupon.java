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
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Locale;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 할인 쿠폰
 * 코드는 대문자/trim 정규화하여 저장하고, 할인액은 최대 할인 한도와 주문 금액을 넘지 않습니다.
 */
@Entity
@Table(name = "coupons")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Coupon {

	private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	private Long id;

	@Column(nullable = false, unique = true, length = 50)
	private String code;

	@Column(nullable = false)
	private String name;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private CouponType type;

	@Column(name = "discount_value", nullable = false, precision = 10, scale = 2)
	private BigDecimal value;

	@Column(name = "minimum_order_amount", nullable = false, precision = 10, scale = 2)
	private BigDecimal minimumOrderAmount;

	// 정률 쿠폰의 최대 할인 금액
	@Column(name = "maximum_discount_amount", precision = 10, scale = 2)
	private BigDecimal maximumDiscountAmount;

	// 전체 사용 한도 (null이면 무제한)
	@Column(name = "usage_limit")
	private Integer usageLimit;

	@Column(name = "usage_limit_per_user", nullable = false)
	private int usageLimitPerUser;

	@Column(name = "valid_from", nullable = false)
	private LocalDateTime validFrom;

	@Column(name = "valid_until", nullable = false)
	private LocalDateTime validUntil;

	@Enumerated(EnumType.STRING)
	@Column(nullable = false, length = 20)
	private CouponStatus status;

	@Column(name = "total_used", nullable = false)
	private int totalUsed;

	@Column(name = "total_discount_given", nullable = false, precision = 12, scale = 2)
	private BigDecimal totalDiscountGiven;

	public static Coupon create(String code, String name, CouponType type, BigDecimal value,
		BigDecimal minimumOrderAmount, BigDecimal maximumDiscountAmount, Integer usageLimit,
		int usageLimitPerUser, LocalDateTime validFrom, LocalDateTime validUntil) {
		if (code == null || code.isBlank()) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "쿠폰 코드는 필수입니다");
		}
		if (value == null || value.signum() <= 0) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "할인 값은 0보다 커야 합니다");
		}
		if (type == CouponType.PERCENTAGE && value.compareTo(HUNDRED) > 0) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "할인율은 100%를 넘을 수 없습니다");
		}
		if (validFrom == null || validUntil == null || !validUntil.isAfter(validFrom)) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "쿠폰 유효기간이 올바르지 않습니다");
		}
		if (usageLimitPerUser <= 0 || (usageLimit != null && usageLimit <= 0)) {
			throw new BusinessException(ErrorCode.VALIDATION_ERROR, "사용 한도는 1 이상이어야 합니다");
		}

		Coupon coupon = new Coupon();
		coupon.code = normalizeCode(code);
		coupon.name = name;
		coupon.type = type;
		coupon.value = value;
		coupon.minimumOrderAmount = minimumOrderAmount == null ? BigDecimal.ZERO : minimumOrderAmount;
		coupon.maximumDiscountAmount = maximumDiscountAmount;
		coupon.usageLimit = usageLimit;
		coupon.usageLimitPerUser = usageLimitPerUser;
		coupon.validFrom = validFrom;
		coupon.validUntil = validUntil;
		coupon.status = CouponStatus.ACTIVE;
		coupon.totalUsed = 0;
		coupon.totalDiscountGiven = BigDecimal.ZERO;
		return coupon;
	}

	public static String normalizeCode(String code) {
		return code.trim().toUpperCase(Locale.ROOT);
	}

	/**
	 * 활성 상태 + 유효기간 + 전체 사용 한도
	 */
	public boolean isAvailable(LocalDateTime now) {
		return status == CouponStatus.ACTIVE
			&& !now.isBefore(validFrom)
			&& !now.isAfter(validUntil)
			&& (usageLimit == null || totalUsed < usageLimit);
	}

	public boolean meetsMinimumOrder(BigDecimal orderAmount) {
		return orderAmount.compareTo(minimumOrderAmount) >= 0;
	}

	public BigDecimal calculateDiscount(BigDecimal orderAmount) {
		if (orderAmount == null || orderAmount.signum() <= 0) {
			return BigDecimal.ZERO;
		}
		BigDecimal discount;
		if (type == CouponType.PERCENTAGE) {
			discount = orderAmount.multiply(value).divide(HUNDRED, 2, RoundingMode.HALF_UP);
			if (maximumDiscountAmount != null) {
				discount = discount.min(maximumDiscountAmount);
			}
		} else {
			discount = value;
		}
		return discount.min(orderAmount).max(BigDecimal.ZERO).setScale(2, RoundingMode.HALF_UP);
	}

	public void increaseUsage(BigDecimal discountAmount) {
		this.totalUsed++;
		this.totalDiscountGiven = this.totalDiscountGiven.add(discountAmount);
	}

	public void deactivate() {
		this.status = CouponStatus.INACTIVE;
	}
}
