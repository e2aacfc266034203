package com.coursetrack.api.payment.dtos;

import com.coursetrack.domain.payment.Payment;
import com.coursetrack.domain.payment.PaymentStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public class PaymentDtos {

    public record Response(
            Long id,
            Long enrollmentId,
            BigDecimal amount,
            String currency,
            PaymentStatus status,
            LocalDateTime completedAt
    ) {
        public static Response from(Payment payment) {
            return new Response(
                    payment.getId(),
                    payment.getEnrollment().getId(),
                    payment.getAmount(),
                    payment.getCurrency(),
                    payment.getStatus(),
                    payment.getCompletedAt()
            );
        }
    }
}
