// src/main/java/com/example/blog/BlogApplication.java
package com.example.blog;

import com.example.blog.config.BlogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication(exclude = UserDetailsServiceAutoConfiguration.class)
@EnableConfigurationProperties(BlogProperties.class)
public class BlogApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlogApplication.class, args);
    }

    /** 발행일·세션 만료 계산용 시계 (테스트에서 교체 가능) */
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
