package com.coursetrack.api.auth;

import com.coursetrack.api.exception.BusinessException;
import com.coursetrack.api.exception.ErrorCode;
import com.coursetrack.domain.tenant.TenantRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

@Component
@RequiredArgsConstructor
public class AuthenticatedLearnerArgumentResolver implements HandlerMethodArgumentResolver {

    private final JwtTokenProvider jwtTokenProvider;
    private final TenantRepository tenantRepository;

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(AuthenticatedLearner.class)
                && LearnerPrincipal.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public LearnerPrincipal resolveArgument(MethodParameter parameter,
                                            ModelAndViewContainer mavContainer,
                                            NativeWebRequest webRequest,
                                            WebDataBinderFactory binderFactory) {
        LearnerPrincipal principal = jwtTokenProvider.authenticate(
                webRequest.getHeader(HttpHeaders.AUTHORIZATION));

        if (!tenantRepository.existsByIdAndActiveTrue(principal.tenantId())) {
            throw new BusinessException(ErrorCode.TENANT_INACTIVE);
        }
        return principal;
    }
}
