package com.example.enrollment.entity;

public enum CouponType {
	PERCENTAGE,
	FIXED_AMOUNT
}
