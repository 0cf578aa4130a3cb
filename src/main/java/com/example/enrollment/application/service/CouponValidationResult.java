package com.example.enrollment.application.service;

import com.example.enrollment.entity.Coupon;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CouponValidationResult {

	private final boolean valid;
	private final Coupon coupon;
	private final String message;

	public static CouponValidationResult valid(Coupon coupon) {
		return new CouponValidationResult(true, coupon, "Discount code is valid");
	}

	public static CouponValidationResult invalid(Coupon coupon, String message) {
		return new CouponValidationResult(false, coupon, message);
	}
}
