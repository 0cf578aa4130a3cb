package com.example.enrollment.entity;

public enum TransactionStatus {
	SUCCEEDED,
	FAILED
}
