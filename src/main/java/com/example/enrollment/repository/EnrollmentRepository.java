package com.example.enrollment.repository;

import com.example.enrollment.entity.Enrollment;
import com.example.enrollment.entity.EnrollmentStatus;
import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface EnrollmentRepository extends JpaRepository<Enrollment, String> {

	Optional<Enrollment> findByUserIdAndCourseId(Long userId, Long courseId);

	boolean existsByUserIdAndCourseId(Long userId, Long courseId);

	// 상태 변경은 모두 이 조회(SELECT ... FOR UPDATE) 이후에 수행합니다. 3초 내 락 획득 실패 시 예외
	@Lock(LockModeType.PESSIMISTIC_WRITE)
	@QueryHints({@QueryHint(name = "jakarta.persistence.lock.timeout", value = "3000")})
	@Query("SELECT e FROM Enrollment e WHERE e.id = :id")
	Optional<Enrollment> findByIdForUpdate(@Param("id") String id);

	Page<Enrollment> findByUserId(Long userId, Pageable pageable);

	Page<Enrollment> findByUserIdAndStatus(Long userId, EnrollmentStatus status, Pageable pageable);

	// 활성화 재시도 대상: ACTIVATING + 재시도 횟수 남음 + 재시도 시각 도래(또는 미지정)
	@Query("SELECT e.id FROM Enrollment e " +
		"WHERE e.status = :status AND e.activationAttempts < e.maxRetries " +
		"AND (e.nextRetryAt IS NULL OR e.nextRetryAt <= :now) " +
		"ORDER BY e.nextRetryAt ASC")
	List<String> findActivationRetryCandidates(@Param("status") EnrollmentStatus status,
		@Param("now") LocalDateTime now, Pageable pageable);
}
