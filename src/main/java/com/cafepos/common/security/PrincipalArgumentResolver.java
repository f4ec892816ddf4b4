package com.cafepos.common.security;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link Principal} from the identity headers set by the API gateway
 * after it has validated the caller's token.
 *
 * <pre>
 *   Client → Gateway (JWT check) → X-User-Id / X-User-Role → this resolver
 * </pre>
 */
@Component
public class PrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentPrincipal.class)
                && Principal.class.equals(parameter.getParameterType());
    }

    @Override
    public Principal resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                     NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String userId = webRequest.getHeader(USER_ID_HEADER);
        String role = webRequest.getHeader(USER_ROLE_HEADER);
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(role)) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED);
        }
        try {
            return new Principal(Long.valueOf(userId.trim()), Role.valueOf(role.trim().toUpperCase()));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.UNAUTHENTICATED, "Malformed identity headers");
        }
    }
}
