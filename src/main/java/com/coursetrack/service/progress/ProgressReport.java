package com.coursetrack.service.progress;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;

/**
 * 클라이언트가 보낸 진도 보고 한 건.
 * watchTimeSeconds, lastPositionSeconds가 null이면 기존 값을 유지한다.
 */
public record ProgressReport(
        int completionPercentage,
        Integer watchTimeSeconds,
        Integer lastPositionSeconds
) {

    public static ProgressReport completion(int completionPercentage) {
        return new ProgressReport(completionPercentage, null, null);
    }

    public void validate() {
        if (completionPercentage < 0 || completionPercentage > 100) {
            throw new BusinessException(ErrorCode.INVALID_PROGRESS,
                    "completionPercentage는 0~100 사이여야 합니다: " + completionPercentage);
        }
        if (watchTimeSeconds != null && watchTimeSeconds < 0) {
            throw new BusinessException(ErrorCode.INVALID_PROGRESS,
                    "watchTime은 0 이상이어야 합니다: " + watchTimeSeconds);
        }
        if (lastPositionSeconds != null && lastPositionSeconds < 0) {
            throw new BusinessException(ErrorCode.INVALID_PROGRESS,
                    "lastPosition은 0 이상이어야 합니다: " + lastPositionSeconds);
        }
    }
}
