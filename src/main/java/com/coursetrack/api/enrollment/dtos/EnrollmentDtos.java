package com.coursetrack.api.enrollment.dtos;

import com.coursetrack.domain.enrollment.Enrollment;
import com.coursetrack.domain.enrollment.EnrollmentStatus;
import com.coursetrack.service.enrollment.EnrollmentResult;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public class EnrollmentDtos {

    public record EnrollResponse(
            Long enrollmentId,
            Long courseId,
            EnrollmentStatus status,
            Long paymentId,
            BigDecimal amount,
            String currency
    ) {
        public static EnrollResponse from(EnrollmentResult result) {
            Enrollment enrollment = result.enrollment();
            if (result.payment() == null) {
                return new EnrollResponse(enrollment.getId(), enrollment.getCourse().getId(),
                        enrollment.getStatus(), null, null, null);
            }
            return new EnrollResponse(
                    enrollment.getId(),
                    enrollment.getCourse().getId(),
                    enrollment.getStatus(),
                    result.payment().getId(),
                    result.payment().getAmount(),
                    result.payment().getCurrency()
            );
        }
    }

    public record Response(
            Long id,
            Long courseId,
            String courseTitle,
            EnrollmentStatus status,
            Integer completionPercentage,
            LocalDateTime enrolledAt,
            LocalDateTime completedAt,
            LocalDateTime withdrawnAt
    ) {
        public static Response from(Enrollment enrollment) {
            return new Response(
                    enrollment.getId(),
                    enrollment.getCourse().getId(),
                    enrollment.getCourse().getTitle(),
                    enrollment.getStatus(),
                    enrollment.getCompletionPercentage(),
                    enrollment.getEnrolledAt(),
                    enrollment.getCompletedAt(),
                    enrollment.getWithdrawnAt()
            );
        }
    }

    public record StatusResponse(
            Long id,
            Long courseId,
            EnrollmentStatus status,
            Integer completionPercentage,
            LocalDateTime withdrawnAt
    ) {
        public static StatusResponse from(Enrollment enrollment) {
            return new StatusResponse(
                    enrollment.getId(),
                    enrollment.getCourse().getId(),
                    enrollment.getStatus(),
                    enrollment.getCompletionPercentage(),
                    enrollment.getWithdrawnAt()
            );
        }
    }
}
