package com.cafepos.common.security;

import com.cafepos.common.exception.BusinessException;
import com.cafepos.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.ServletWebRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrincipalArgumentResolverTest {

    private final PrincipalArgumentResolver resolver = new PrincipalArgumentResolver();

    @Test
    @DisplayName("게이트웨이 헤더로 Principal 생성")
    void resolveArgument_FromHeaders() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-User-Id", "42");
        request.addHeader("X-User-Role", "admin");

        Principal principal = resolver.resolveArgument(null, null, new ServletWebRequest(request), null);

        assertThat(principal.userId()).isEqualTo(42L);
        assertThat(principal.role()).isEqualTo(Role.ADMIN);
    }

    @Test
    @DisplayName("헤더 누락 시 인증 오류")
    void resolveArgument_MissingHeaders_ThrowsException() {
        assertThatThrownBy(() -> resolver.resolveArgument(null, null,
                new ServletWebRequest(new MockHttpServletRequest()), null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.UNAUTHENTICATED));
    }

    @Test
    @DisplayName("알 수 없는 역할은 인증 오류")
    void resolveArgument_UnknownRole_ThrowsException() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-User-Id", "42");
        request.addHeader("X-User-Role", "CASHIER");

        assertThatThrownBy(() -> resolver.resolveArgument(null, null, new ServletWebRequest(request), null))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode()).isEqualTo(ErrorCode.UNAUTHENTICATED));
    }
}
