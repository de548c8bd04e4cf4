package com.example.blog.domain;

/**
 * 사용자 권한. 가입 시점에 한 번 정해지고 이후 바뀌지 않는다.
 */
public enum UserRole {
    ADMIN,
    MEMBER
}
