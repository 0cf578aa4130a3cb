package com.example.enrollment.web.external;

import com.example.enrollment.entity.Enrollment;

/**
 * LMS에 강의 접근 권한을 등록합니다.
 * false 반환 또는 예외는 모두 일시적 실패로 보고 활성화 재시도 대상이 됩니다.
 */
public interface CourseProvisioningClient {

	boolean provision(Enrollment enrollment);
}
