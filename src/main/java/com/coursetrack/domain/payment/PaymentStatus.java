package com.coursetrack.domain.payment;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED
}
