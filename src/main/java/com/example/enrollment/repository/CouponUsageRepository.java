package com.example.enrollment.repository;

import com.example.enrollment.entity.CouponUsage;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CouponUsageRepository extends JpaRepository<CouponUsage, Long> {

	long countByCouponIdAndUserId(Long couponId, Long userId);
}
