package com.example.enrollment.repository;

import com.example.enrollment.entity.CourseProgress;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CourseProgressRepository extends JpaRepository<CourseProgress, Long> {

	Optional<CourseProgress> findByUserIdAndCourseId(Long userId, Long courseId);
}
