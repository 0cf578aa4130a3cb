package com.example.enrollment.entity;

public enum CouponStatus {
	ACTIVE,
	INACTIVE,
	EXPIRED
}
