package com.example.blog.web;

import com.example.blog.common.ForbiddenException;
import com.example.blog.common.ResourceNotFoundException;
import com.example.blog.security.Identity;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * 권한 실패 / 미존재 리소스를 일반적인 403·404 화면으로 변환.
 * 상세 사유는 로그에만 남기고 화면에는 노출하지 않는다.
 */
@Slf4j
@ControllerAdvice
@RequiredArgsConstructor
public class WebExceptionAdvice {

    private final HeaderModelAdvice headerModelAdvice;

    @ExceptionHandler(ForbiddenException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public String handleForbidden(ForbiddenException ex, HttpServletRequest request, Model model) {
        log.warn("⛔️ 403 {} {} ({})", request.getMethod(), request.getRequestURI(), ex.getMessage());
        headerModelAdvice.headerAttributes(identityOf(request), model);
        return "error/403";
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public String handleNotFound(ResourceNotFoundException ex, HttpServletRequest request, Model model) {
        log.info("404 {} {} ({})", request.getMethod(), request.getRequestURI(), ex.getMessage());
        headerModelAdvice.headerAttributes(identityOf(request), model);
        return "error/404";
    }

    /* 예외 처리 시점에는 인터셉터가 남긴 값만 사용 (쿠키를 다시 해석하지 않음) */
    private static Identity identityOf(HttpServletRequest request) {
        Object cached = request.getAttribute(Identity.REQUEST_ATTRIBUTE);
        return (cached instanceof Identity identity) ? identity : Identity.anonymous();
    }
}
