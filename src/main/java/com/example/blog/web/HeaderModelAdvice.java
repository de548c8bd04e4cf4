package com.example.blog.web;

import com.example.blog.security.AuthorizationPolicy;
import com.example.blog.security.Identity;
import lombok.RequiredArgsConstructor;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ModelAttribute;

/**
 * 모든 화면 상단(nav)에서 쓰는 로그인 상태 값.
 */
@ControllerAdvice(annotations = org.springframework.stereotype.Controller.class)
@RequiredArgsConstructor
public class HeaderModelAdvice {

    private final AuthorizationPolicy policy;

    @ModelAttribute
    public void headerAttributes(Identity identity, Model model) {
        model.addAttribute("loggedIn", identity.isAuthenticated());
        model.addAttribute("isAdmin", policy.isAdministrator(identity));
        model.addAttribute("canDeletePost", policy.canDeletePost(identity));
        model.addAttribute("currentUserId", identity.userId());
        model.addAttribute("currentUserName", identity.name());
    }
}
