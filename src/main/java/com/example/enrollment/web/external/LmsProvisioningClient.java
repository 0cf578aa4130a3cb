package com.example.enrollment.web.external;

import com.example.enrollment.entity.Enrollment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LmsProvisioningClient implements CourseProvisioningClient {

	/** LMS 연동 (모킹): 항상 성공 */
	@Override
	public boolean provision(Enrollment enrollment) {
		log.info("Provisioning course access: enrollmentId={}, userId={}, courseId={}",
			enrollment.getId(), enrollment.getUserId(), enrollment.getCourseId());
		return true;
	}
}
