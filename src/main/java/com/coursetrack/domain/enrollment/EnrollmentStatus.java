package com.coursetrack.domain.enrollment;

import java.util.EnumSet;
import java.util.Set;

public enum EnrollmentStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    WITHDRAWN;

    /**
     * 같은 강좌에 대해 학습자당 하나만 존재할 수 있는 상태
     */
    public static final Set<EnrollmentStatus> OPEN = EnumSet.of(PENDING, ACTIVE);

    /**
     * 정원 계산에 포함되는 상태
     */
    public static final Set<EnrollmentStatus> SEAT_HOLDING = EnumSet.of(PENDING, ACTIVE, COMPLETED);
}
