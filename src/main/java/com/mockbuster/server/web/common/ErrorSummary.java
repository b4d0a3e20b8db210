package com.mockbuster.server.web.common;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 예상하지 못한 오류(500)일 때 응답 error 필드에 들어갈 요약 문구.
 * {@link GlobalExceptionHandler} 가 처리 중이던 컨트롤러 메서드에서 읽는다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ErrorSummary {
    String value();
}
