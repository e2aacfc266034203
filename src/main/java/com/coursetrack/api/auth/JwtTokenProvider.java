package com.coursetrack.api.auth;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.config.JwtProperties;
import com.coursetrack.domain.learner.LearnerRole;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;

/**
 * HS256 Bearer 토큰 발급/검증
 *
 * sub = 학습자 ID, tenant = 테넌트 ID, role = 역할
 */
@Slf4j
@Component
public class JwtTokenProvider {

    private static final String BEARER_PREFIX = "Bearer ";
    private static final String TENANT_CLAIM = "tenant";
    private static final String ROLE_CLAIM = "role";

    private final SecretKey secretKey;
    private final JwtProperties properties;

    public JwtTokenProvider(JwtProperties properties) {
        this.properties = properties;
        this.secretKey = new SecretKeySpec(
                properties.getSecret().getBytes(StandardCharsets.UTF_8),
                "HmacSHA256"
        );
    }

    public String issue(Long learnerId, Long tenantId, LearnerRole role) {
        Instant now = Instant.now();
        return Jwts.builder()
                .subject(String.valueOf(learnerId))
                .claim(TENANT_CLAIM, tenantId)
                .claim(ROLE_CLAIM, role.name())
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(properties.getTtl())))
                .signWith(secretKey)
                .compact();
    }

    /**
     * Authorization 헤더 값을 검증하고 요청 주체를 꺼낸다.
     *
     * @param authorizationHeader "Bearer {token}" 형식
     */
    public LearnerPrincipal authenticate(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();

        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            Long learnerId = Long.valueOf(claims.getSubject());
            Long tenantId = claims.get(TENANT_CLAIM, Long.class);
            String role = claims.get(ROLE_CLAIM, String.class);
            if (tenantId == null || role == null) {
                throw new BusinessException(ErrorCode.UNAUTHORIZED, "필수 claim 누락");
            }
            return new LearnerPrincipal(learnerId, tenantId, LearnerRole.valueOf(role));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Bearer 토큰 검증 실패: {}", e.getMessage());
            throw new BusinessException(ErrorCode.UNAUTHORIZED);
        }
    }
}
