package com.example.blog.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.csrf.CookieCsrfTokenRepository;
import org.springframework.security.web.csrf.CsrfTokenRequestAttributeHandler;

/**
 * 애플리케이션 보안 설정.
 * - 인증 상태는 서명된 세션 쿠키({@link com.example.blog.security.AuthSessionService})로 관리하므로
 *   Spring Security 의 formLogin / logout / httpBasic 은 끈다.
 * - 여기서는 CSRF 보호와 비밀번호 해시만 담당한다.
 * - 인가는 URL 규칙이 아니라 각 핸들러의 가드 호출({@link com.example.blog.security.AuthorizationPolicy})로 처리한다.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AppSecurityConfig {

    private final BlogProperties props;

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain appSecurity(HttpSecurity http) throws Exception {
        // Thymeleaf 에서 _csrf 이름으로 접근하도록 핸들러 설정
        var handler = new CsrfTokenRequestAttributeHandler();
        handler.setCsrfRequestAttributeName("_csrf");

        http
                .csrf(csrf -> csrf
                        .csrfTokenRequestHandler(handler)
                        .csrfTokenRepository(CookieCsrfTokenRepository.withHttpOnlyFalse()))
                .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
                .formLogin(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .requestCache(AbstractHttpConfigurer::disable);

        return http.build();
    }

    @Bean
    public ApplicationRunner postDeletionPolicyReporter() {
        return args -> {
            if (props.getPosts().isPublicDelete()) {
                log.warn("⚠️ blog.posts.public-delete=true → 로그인하지 않은 사용자도 게시글을 삭제할 수 있습니다.");
            } else {
                log.info("✅ 게시글 삭제는 관리자만 가능합니다.");
            }
        };
    }
}
