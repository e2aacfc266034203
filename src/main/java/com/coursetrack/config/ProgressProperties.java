package com.coursetrack.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 진도 기록 설정 (coursetrack.progress)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "coursetrack.progress")
public class ProgressProperties {

    /**
     * 레슨 완료로 판정하는 진도율 (%)
     */
    @Min(1)
    @Max(100)
    private int completionThreshold = 95;

    /**
     * 락 충돌 시 최대 시도 횟수
     */
    @Min(1)
    private int maxRetries = 5;

    /**
     * 재시도 간 기본 대기 시간 (ms). 시도 횟수에 비례해 늘어난다.
     */
    @Min(0)
    private long retryBackoffMs = 20;
}
