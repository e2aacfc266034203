package com.coursetrack.api.auth;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.learner.LearnerRole;

/**
 * 토큰으로 인증된 요청 주체. 모든 조회와 변경은 이 학습자와 테넌트 범위로 제한된다.
 */
public record LearnerPrincipal(
        Long learnerId,
        Long tenantId,
        LearnerRole role
) {

    public boolean isAdmin() {
        return role == LearnerRole.ADMIN;
    }

    public boolean canAuthorCourses() {
        return role == LearnerRole.INSTRUCTOR || role == LearnerRole.ADMIN;
    }

    public void requireAdmin() {
        if (!isAdmin()) {
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
    }

    public void requireAuthor() {
        if (!canAuthorCourses()) {
            throw new BusinessException(ErrorCode.FORBIDDEN);
        }
    }
}
