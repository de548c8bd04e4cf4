package com.example.blog.security;

import com.example.blog.common.ResourceNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Slf4j
@Component
@RequiredArgsConstructor
public class IdentityInterceptor implements HandlerInterceptor {

    private final AuthSessionService authSessionService;

    @Override
    public boolean preHandle(HttpServletRequest req, HttpServletResponse res, Object handler) {
        try {
            req.setAttribute(Identity.REQUEST_ATTRIBUTE, authSessionService.currentIdentity(req));
        } catch (ResourceNotFoundException ex) {
            // 서명은 유효하나 사용자가 사라진 쿠키: 이번 요청은 404, 쿠키는 즉시 만료
            log.warn("🧹 사라진 사용자의 세션 쿠키 만료 ({})", ex.getMessage());
            authSessionService.logout(res);
            req.setAttribute(Identity.REQUEST_ATTRIBUTE, Identity.anonymous());
            throw ex;
        }
        return true; // 항상 흐름은 계속 진행 (권한 체크는 컨트롤러에서 가드 호출)
    }
}
