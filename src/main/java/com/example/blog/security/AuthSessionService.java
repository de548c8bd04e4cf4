// ─────────────────────────────────────────────────────────────────────────────
// 로그인 세션 유지 로직 (쿠키 기반)
// ─────────────────────────────────────────────────────────────────────────────
// ① AuthSessionService       : 쿠키 발급·검증 + HMAC 서명, TTL 만료
// ② IdentityInterceptor      : 모든 요청에서 쿠키 → Identity 변환 후 request attribute 저장
// ③ IdentityArgumentResolver : 컨트롤러 파라미터로 Identity 전달
// ─────────────────────────────────────────────────────────────────────────────
package com.example.blog.security;

import com.example.blog.common.ResourceNotFoundException;
import com.example.blog.config.BlogProperties;
import com.example.blog.domain.User;
import com.example.blog.repository.UserRepository;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.util.Arrays;
import java.util.Base64;
import java.util.Optional;

/**
 * 로그인 세션 토큰 발급 & 검증 서비스.
 * <pre>
 * token 구조: base64("userId|epochMillis|HMAC(userId|epochMillis, secretKey)")
 * - userId      : 로그인한 사용자 id
 * - epochMillis : 발급 시각 (ms)
 * - HMAC        : SHA-256 서명 → 위·변조 방지
 * </pre>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthSessionService {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private final BlogProperties props;
    private final UserRepository userRepo;
    private final Clock clock;

    /* ────────── 로그인: 쿠키 발급 ────────── */
    public void login(HttpServletResponse res, User user) {
        String token = issueToken(user.getId(), clock.millis());
        res.addCookie(sessionCookie(token, Math.toIntExact(props.getSession().getTtl().toSeconds())));
        log.info("💾 세션 쿠키 발급 (userId={})", user.getId());
    }

    /* ────────── 로그아웃: 쿠키 만료 ────────── */
    public void logout(HttpServletResponse res) {
        res.addCookie(sessionCookie("", 0));
    }

    /**
     * 요청 쿠키로부터 현재 사용자를 찾는다. 쿠키가 없거나 위조·만료된 경우 익명.
     *
     * @throws ResourceNotFoundException 서명은 유효하지만 해당 사용자가 DB에 없을 때
     */
    @Transactional(readOnly = true)
    public Identity currentIdentity(HttpServletRequest req) {
        Optional<Long> userId = readCookie(req.getCookies()).flatMap(this::verify);
        if (userId.isEmpty()) {
            return Identity.anonymous();
        }
        User user = userRepo.findById(userId.get())
                .orElseThrow(() -> new ResourceNotFoundException("user", userId.get()));
        return Identity.of(user);
    }

    /* ────────── 토큰 생성 ────────── */
    String issueToken(long userId, long issuedAtMillis) {
        String payload = userId + "|" + issuedAtMillis;
        String raw = payload + "|" + hmacSha256(payload);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }

    /* ────────── 유효성 검사 ────────── */
    Optional<Long> verify(String token) {
        String[] parts;
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(token), StandardCharsets.UTF_8);
            parts = decoded.split("\\|");
        } catch (IllegalArgumentException e) {
            log.warn("⛔️ 세션 토큰 디코딩 실패: {}", e.getMessage());
            return Optional.empty();
        }
        if (parts.length != 3) return Optional.empty();

        long userId;
        long issuedAt;
        try {
            userId   = Long.parseLong(parts[0]);
            issuedAt = Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            log.warn("⛔️ 세션 토큰 형식 오류: {}", e.getMessage());
            return Optional.empty();
        }

        // 서명 검증
        String expected = hmacSha256(parts[0] + "|" + parts[1]);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                parts[2].getBytes(StandardCharsets.UTF_8))) {
            log.warn("⛔️ 세션 토큰 서명 불일치 (userId={})", userId);
            return Optional.empty();
        }

        // 만료 체크
        if (clock.millis() - issuedAt > props.getSession().getTtl().toMillis()) {
            return Optional.empty();
        }
        return Optional.of(userId);
    }

    private Optional<String> readCookie(Cookie[] cookies) {
        if (cookies == null) return Optional.empty();
        String name = props.getSession().getCookieName();
        return Arrays.stream(cookies)
                .filter(c -> name.equals(c.getName()))
                .map(Cookie::getValue)
                .filter(v -> v != null && !v.isBlank())
                .findFirst();
    }

    private Cookie sessionCookie(String value, int maxAgeSeconds) {
        Cookie c = new Cookie(props.getSession().getCookieName(), value);
        c.setMaxAge(maxAgeSeconds);
        c.setPath("/");
        c.setHttpOnly(true);
        c.setSecure(props.getSession().isSecure());
        return c;
    }

    /* ────────── 내부: HMAC SHA-256 ────────── */
    private String hmacSha256(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(props.getSecretKey().getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] raw = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(raw);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC 계산 실패", e);
        }
    }
}
