package com.example.blog.common;

/**
 * 권한 정책을 통과하지 못한 요청. 응답은 항상 일반적인 403 화면이며
 * 메시지는 로그에만 남긴다.
 */
public class ForbiddenException extends RuntimeException {

    public ForbiddenException(String message) {
        super(message);
    }
}
