package com.example.enrollment.repository;

import com.example.enrollment.entity.Payment;
import com.example.enrollment.entity.PaymentStatus;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PaymentRepository extends JpaRepository<Payment, String> {

	List<Payment> findByEnrollmentIdOrderByCreatedAtDesc(String enrollmentId);

	List<Payment> findByEnrollmentIdAndStatus(String enrollmentId, PaymentStatus status);

	// threshold 이전에 생성되었는데 아직 PENDING인 결제 (2단계와 3단계 사이에서 중단된 결제)
	List<Payment> findByStatusAndCreatedAtBefore(PaymentStatus status, LocalDateTime threshold);

	// 응답 시간 초과로 FAILED 처리됐지만 PG 결제내역을 아직 확인하지 않은 결제
	List<Payment> findByStatusAndErrorCodeAndGatewayCheckedAtIsNullAndCreatedAtBefore(PaymentStatus status,
		String errorCode, LocalDateTime threshold);

	boolean existsByEnrollmentIdAndStatusAndErrorCodeAndGatewayCheckedAtIsNull(String enrollmentId,
		PaymentStatus status, String errorCode);

	// 결제 엔티티를 영속성 컨텍스트에 올리지 않고 수강 신청 ID만 조회 (수강 신청 잠금 후 결제를 읽기 위함)
	@Query("SELECT p.enrollmentId FROM Payment p WHERE p.id = :id")
	Optional<String> findEnrollmentIdById(@Param("id") String id);
}
