package com.example.enrollment.entity;

public enum TransactionType {
	CHARGE,
	REFUND
}
