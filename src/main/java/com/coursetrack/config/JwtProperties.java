package com.coursetrack.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Bearer 토큰 서명 설정 (coursetrack.jwt)
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "coursetrack.jwt")
public class JwtProperties {

    /**
     * HS256 서명 키. 32바이트 이상이어야 한다.
     */
    @NotBlank(message = "coursetrack.jwt.secret must be configured")
    private String secret;

    @NotNull
    private Duration ttl = Duration.ofHours(12);
}
