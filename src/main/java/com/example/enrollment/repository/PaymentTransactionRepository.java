package com.example.enrollment.repository;

import com.example.enrollment.entity.PaymentTransaction;
import com.example.enrollment.entity.TransactionStatus;
import com.example.enrollment.entity.TransactionType;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

	List<PaymentTransaction> findByPaymentIdOrderByCreatedAtAsc(String paymentId);

	boolean existsByPaymentIdAndTypeAndStatus(String paymentId, TransactionType type, TransactionStatus status);
}
