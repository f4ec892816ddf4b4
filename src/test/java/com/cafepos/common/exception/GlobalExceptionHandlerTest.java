package com.cafepos.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("비즈니스 예외는 에러 코드의 상태/타입/코드로 변환")
    void handleBusinessException_MapsKindToStatus() {
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.INVALID_ORDER_STATUS, "Order ORD-20261019-0001 is CANCELLED"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        ProblemDetail problem = response.getBody();
        assertThat(problem).isNotNull();
        assertThat(problem.getDetail()).isEqualTo("Order ORD-20261019-0001 is CANCELLED");
        assertThat(problem.getType().toString()).isEqualTo("https://cafepos.dev/errors/invalid_order_status");
        assertThat(problem.getProperties())
                .containsEntry("code", "INVALID_ORDER_STATUS")
                .containsEntry("kind", "INVALID_STATE");
    }

    @Test
    @DisplayName("권한 부족은 403")
    void handleBusinessException_Forbidden() {
        ResponseEntity<ProblemDetail> response = handler.handleBusinessException(
                new BusinessException(ErrorCode.ACCESS_DENIED));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    @DisplayName("재시도 후에도 남은 무결성 충돌은 409 DATA_CONFLICT")
    void handleConflict_ReturnsDataConflict() {
        ResponseEntity<ProblemDetail> response = handler.handleConflict(
                new DataIntegrityViolationException("uk_customer_phone"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().getProperties()).containsEntry("code", "DATA_CONFLICT");
    }
}
