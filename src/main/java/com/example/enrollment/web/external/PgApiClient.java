package com.example.enrollment.web.external;

import com.example.enrollment.web.external.dto.PgApproveRequest;
import com.example.enrollment.web.external.dto.PgApproveResponse;
import com.example.enrollment.web.external.dto.PgCancelRequest;
import com.example.enrollment.web.external.dto.PgCancelResponse;
import com.example.enrollment.web.external.dto.PgPaymentHistory;

/**
 * 외부 PG 연동
 * 모든 호출은 paymentId를 멱등키로 사용합니다. 같은 paymentId로 다시 승인 요청해도 이중 출금되지 않아야 합니다.
 */
public interface PgApiClient {

	PgApproveResponse approve(PgApproveRequest request);

	/** 승인된 결제의 취소(환불) */
	PgCancelResponse cancel(PgCancelRequest request);

	/** 결제 보정용 결제내역 조회 */
	PgPaymentHistory findPaymentHistory(String paymentId);
}
