package com.mockbuster.server.domain.common.exception;

/**
 * 저장소에서 발생한 오류(연결, 쿼리, 매핑 실패)를 감싸는 예외.
 * 메시지는 "작업 설명: 원인 메시지" 형식이며 원인 예외를 그대로 보존한다.
 */
public class DatabaseException extends RuntimeException {

    public DatabaseException(String context, Throwable cause) {
        super(context + ": " + describe(cause), cause);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
