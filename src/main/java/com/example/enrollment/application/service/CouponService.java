package com.example.enrollment.application.service;

import com.example.enrollment.application.exception.BusinessException;
import com.example.enrollment.application.exception.ErrorCode;
import com.example.enrollment.entity.Coupon;
import com.example.enrollment.entity.CouponUsage;
import com.example.enrollment.repository.CouponRepository;
import com.example.enrollment.repository.CouponUsageRepository;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CouponService {

	private final CouponRepository couponRepository;
	private final CouponUsageRepository couponUsageRepository;

	/**
	 * 쿠폰 검증 (변경 없음)
	 * 존재 여부 -> 활성/유효기간/전체 한도 -> 최소 주문 금액 -> 사용자별 한도 순서로 확인하고 첫 실패 사유를 반환합니다.
	 */
	@Transactional(readOnly = true)
	public CouponValidationResult validate(String code, Long userId, BigDecimal orderAmount) {
		if (code == null || code.isBlank()) {
			return CouponValidationResult.invalid(null, "Invalid discount code");
		}
		Optional<Coupon> found = couponRepository.findByCode(Coupon.normalizeCode(code));
		if (found.isEmpty()) {
			return CouponValidationResult.invalid(null, "Invalid discount code");
		}
		Coupon coupon = found.get();

		if (!coupon.isAvailable(LocalDateTime.now())) {
			return CouponValidationResult.invalid(coupon, "Discount code has expired or is not active");
		}
		if (!coupon.meetsMinimumOrder(orderAmount)) {
			return CouponValidationResult.invalid(coupon,
				"Minimum order amount is " + coupon.getMinimumOrderAmount().toPlainString());
		}
		long used = couponUsageRepository.countByCouponIdAndUserId(coupon.getId(), userId);
		if (used >= coupon.getUsageLimitPerUser()) {
			return CouponValidationResult.invalid(coupon, "You have reached the usage limit for this coupon");
		}
		return CouponValidationResult.valid(coupon);
	}

	/**
	 * 할인 적용. 할인액이 0보다 클 때만 사용 이력과 누적 사용량을 기록합니다.
	 * 호출자 트랜잭션에 참여하므로 수강 신청이 롤백되면 쿠폰 사용도 함께 롤백됩니다.
	 */
	@Transactional
	public BigDecimal apply(Coupon coupon, Long userId, BigDecimal orderAmount) {
		Coupon locked = couponRepository.findByIdForUpdate(coupon.getId())
			.orElseThrow(() -> new BusinessException(ErrorCode.INVALID_DISCOUNT, "Invalid discount code"));

		// 검증 이후 다른 요청이 전체 한도를 소진했을 수 있음
		if (!locked.isAvailable(LocalDateTime.now())) {
			throw new BusinessException(ErrorCode.INVALID_DISCOUNT, "Discount code has expired or is not active");
		}

		BigDecimal discount = locked.calculateDiscount(orderAmount);
		if (discount.signum() > 0) {
			couponUsageRepository.save(CouponUsage.of(locked.getId(), userId, orderAmount, discount, LocalDateTime.now()));
			locked.increaseUsage(discount);
			log.info("Coupon applied: code={}, userId={}, discount={}", locked.getCode(), userId, discount);
		}
		return discount;
	}
}
