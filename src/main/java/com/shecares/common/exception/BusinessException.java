package com.shecares.common.exception;

import lombok.Getter;

/**
 * 비즈니스 예외 - 백오피스의 모든 비즈니스 규칙 위반에 사용하는 unchecked 예외.
 *
 * <p>{@link ErrorCode}가 HTTP 상태를 결정하므로 서비스가 상태 코드를 직접 고르지 않는다.
 * 검증 오류(4xx, 404 제외)와 조회 실패(404)는 상태 코드로 구분한다.</p>
 *
 * <pre>
 *   throw new BusinessException(ErrorCode.DELIVERY_NOT_FOUND);
 *   throw new BusinessException(ErrorCode.INVALID_STATUS_TRANSITION,
 *           "Invalid status transition from 'delivered' to 'pending'");
 * </pre>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String detail) {
        super(detail);
        this.errorCode = errorCode;
    }

    /** 호출자 입력이 잘못된 검증 오류 (404를 제외한 4xx). */
    public boolean isValidationError() {
        return errorCode.getStatus().is4xxClientError() && !isNotFound();
    }

    public boolean isNotFound() {
        return errorCode.getStatus().value() == 404;
    }
}
