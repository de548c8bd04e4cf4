// src/main/java/com/example/blog/config/BlogProperties.java
package com.example.blog.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.validator.constraints.time.DurationMax;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * application.yml 의 {@code blog.*} 설정.
 */
@ConfigurationProperties(prefix = "blog")
@Validated
@Getter @Setter
public class BlogProperties {

    /**
     * 세션 쿠키 HMAC 서명 키. 환경 변수 SECRET_KEY 로 주입한다.
     */
    @NotBlank(message = "blog.secret-key (SECRET_KEY) must be set")
    private String secretKey;

    @Valid
    private Session session = new Session();

    @Valid
    private Posts posts = new Posts();

    @Getter @Setter
    public static class Session {
        @NotBlank
        private String cookieName = "blog-session";

        /** 쿠키 Max-Age(int 초) 범위 안이어야 한다 */
        @NotNull
        @DurationMax(days = 3650)
        private Duration ttl = Duration.ofHours(24);

        /** HTTPS 운영 환경에서만 true */
        private boolean secure = false;
    }

    @Getter @Setter
    public static class Posts {
        /**
         * true 이면 로그인하지 않은 사용자도 게시글을 삭제할 수 있다.
         * 기본값 false: 관리자만 삭제 가능.
         */
        private boolean publicDelete = false;
    }
}
