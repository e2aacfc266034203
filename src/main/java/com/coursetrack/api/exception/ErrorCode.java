package com.coursetrack.api.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {

    UNAUTHORIZED(HttpStatus.UNAUTHORIZED, "인증 토큰이 없거나 유효하지 않습니다."),
    TENANT_INACTIVE(HttpStatus.FORBIDDEN, "비활성화되었거나 존재하지 않는 테넌트입니다."),
    FORBIDDEN(HttpStatus.FORBIDDEN, "요청을 수행할 권한이 없습니다."),

    LEARNER_NOT_FOUND(HttpStatus.NOT_FOUND, "학습자를 찾을 수 없습니다."),
    COURSE_NOT_FOUND(HttpStatus.NOT_FOUND, "강좌를 찾을 수 없습니다."),
    MODULE_NOT_FOUND(HttpStatus.NOT_FOUND, "모듈을 찾을 수 없습니다."),
    LESSON_NOT_FOUND(HttpStatus.NOT_FOUND, "레슨을 찾을 수 없습니다."),
    ENROLLMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "수강신청 내역을 찾을 수 없습니다."),
    PAYMENT_NOT_FOUND(HttpStatus.NOT_FOUND, "결제 내역을 찾을 수 없습니다."),

    COURSE_NOT_PUBLISHED(HttpStatus.CONFLICT, "공개되지 않은 강좌입니다."),
    INVALID_COURSE_STATE(HttpStatus.CONFLICT, "현재 강좌 상태에서는 처리할 수 없습니다."),
    DUPLICATE_ORDER(HttpStatus.CONFLICT, "이미 사용 중인 순서 번호입니다."),
    CAPACITY_EXCEEDED(HttpStatus.CONFLICT, "강좌 정원이 초과되었습니다."),
    DUPLICATE_ENROLLMENT(HttpStatus.CONFLICT, "이미 수강 중이거나 결제 대기 중인 강좌입니다."),
    INVALID_ENROLLMENT_STATE(HttpStatus.CONFLICT, "현재 수강 상태에서는 처리할 수 없습니다."),
    PAYMENT_NOT_PENDING(HttpStatus.CONFLICT, "결제 대기 상태가 아닙니다."),

    NOT_ENROLLED(HttpStatus.FORBIDDEN, "수강 중인 강좌가 아닙니다."),
    ENROLLMENT_NOT_ACTIVE(HttpStatus.CONFLICT, "진행 중인 수강이 아니어서 진도를 기록할 수 없습니다."),
    LESSON_NOT_IN_COURSE(HttpStatus.BAD_REQUEST, "수강 중인 강좌에 속한 레슨이 아닙니다."),
    INVALID_PROGRESS(HttpStatus.BAD_REQUEST, "진도 값이 유효하지 않습니다."),
    CONCURRENT_UPDATE_FAILED(HttpStatus.SERVICE_UNAVAILABLE, "동시 요청이 많아 진도를 기록하지 못했습니다. 잠시 후 다시 시도해 주세요."),

    INVALID_REQUEST(HttpStatus.BAD_REQUEST, "입력값 검증에 실패했습니다."),
    NOT_FOUND(HttpStatus.NOT_FOUND, "요청한 API를 찾을 수 없습니다."),
    INTERNAL_SERVER_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "서버 내부 오류가 발생했습니다.");

    private final HttpStatus status;
    private final String message;
}
