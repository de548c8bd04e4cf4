// src/main/java/com/example/blog/web/AuthController.java
package com.example.blog.web;

import com.example.blog.domain.User;
import com.example.blog.security.AuthSessionService;
import com.example.blog.service.UserService;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * 회원가입 / 로그인 / 로그아웃
 */
@Slf4j
@Controller
public class AuthController {

    static final String MSG_DUPLICATE_EMAIL = "A user with that email already exists.";
    static final String MSG_UNKNOWN_EMAIL   = "That email does not exist. Please try again.";
    static final String MSG_BAD_PASSWORD    = "Password incorrect. Please try again.";

    private final UserService userService;
    private final AuthSessionService authSessionService;

    public AuthController(UserService userService,
                          AuthSessionService authSessionService) {
        this.userService = userService;
        this.authSessionService = authSessionService;
    }

    /** 회원가입 폼 */
    @GetMapping("/register")
    public String registerForm(Model model) {
        model.addAttribute("registerForm", new RegisterForm());
        return "register";
    }

    /** 회원가입 처리 → 성공 시 바로 로그인 */
    @PostMapping("/register")
    public String register(@ModelAttribute("registerForm") @Valid RegisterForm form,
                           BindingResult bindingResult,
                           HttpServletResponse response,
                           RedirectAttributes rttr) {
        if (bindingResult.hasErrors()) {
            return "register";
        }
        User user;
        try {
            user = userService.register(form.getEmail(), form.getPassword(), form.getName());
        } catch (DataIntegrityViolationException ex) {
            log.info("중복 가입 시도: {}", form.getEmail());
            rttr.addFlashAttribute("flash", MSG_DUPLICATE_EMAIL);
            return "redirect:/login";
        }
        authSessionService.login(response, user);
        return "redirect:/";
    }

    /** 로그인 폼 */
    @GetMapping("/login")
    public String loginForm(Model model) {
        model.addAttribute("loginForm", new LoginForm());
        return "login";
    }

    /** 로그인 처리 */
    @PostMapping("/login")
    public String login(@ModelAttribute("loginForm") @Valid LoginForm form,
                        BindingResult bindingResult,
                        HttpServletResponse response,
                        RedirectAttributes rttr) {
        if (bindingResult.hasErrors()) {
            return "login";
        }
        try {
            User user = userService.authenticate(form.getEmail(), form.getPassword());
            authSessionService.login(response, user);
            return "redirect:/";
        } catch (UsernameNotFoundException ex) {
            rttr.addFlashAttribute("flash", MSG_UNKNOWN_EMAIL);
        } catch (BadCredentialsException ex) {
            log.info("비밀번호 불일치: {}", form.getEmail());
            rttr.addFlashAttribute("flash", MSG_BAD_PASSWORD);
        }
        return "redirect:/login";
    }

    @GetMapping("/logout")
    public String logout(HttpServletResponse response) {
        authSessionService.logout(response);
        return "redirect:/";
    }
}
