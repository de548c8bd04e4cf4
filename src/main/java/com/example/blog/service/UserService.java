// src/main/java/com/example/blog/service/UserService.java
package com.example.blog.service;

import com.example.blog.common.ResourceNotFoundException;
import com.example.blog.domain.User;
import com.example.blog.domain.UserRole;
import com.example.blog.repository.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 회원가입·로그인 검증 등 사용자 관련 비즈니스 로직
 */
@Slf4j
@Service
@Transactional
public class UserService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;

    public UserService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
    }

    /**
     * 신규 회원가입. 최초 가입자는 관리자(ADMIN), 이후 가입자는 MEMBER.
     * 동시에 들어온 두 최초 가입 중 하나는 admin_slot 유니크 제약에 걸려 실패한다.
     *
     * @param email       로그인 이메일
     * @param rawPassword 암호화되지 않은 비밀번호
     * @param name        표시 이름
     * @return 저장된 User 엔티티
     * @throws DataIntegrityViolationException 이메일 중복 또는 관리자 자리 경합 시
     */
    public User register(String email, String rawPassword, String name) {
        if (userRepository.existsByEmail(email)) {
            throw new DataIntegrityViolationException("이미 가입된 이메일입니다: " + email);
        }
        UserRole role = (userRepository.count() == 0) ? UserRole.ADMIN : UserRole.MEMBER;
        User user = new User(email, passwordEncoder.encode(rawPassword), name, role);
        User saved = userRepository.saveAndFlush(user);
        if (role == UserRole.ADMIN) {
            log.warn("⚠️ 최초 가입자를 관리자로 지정합니다: {} (id={})", email, saved.getId());
        } else {
            log.info("✅ 신규 회원 가입: {} (id={})", email, saved.getId());
        }
        return saved;
    }

    /**
     * 로그인 시 사용자 조회 및 비밀번호 검증
     *
     * @throws UsernameNotFoundException 이메일이 없을 때
     * @throws BadCredentialsException   비밀번호가 틀렸을 때
     */
    @Transactional(readOnly = true)
    public User authenticate(String email, String rawPassword) {
        User user = userRepository.findByEmail(email)
                .orElseThrow(() -> new UsernameNotFoundException("등록된 사용자가 없습니다: " + email));
        if (!passwordEncoder.matches(rawPassword, user.getPassword())) {
            throw new BadCredentialsException("비밀번호가 일치하지 않습니다.");
        }
        return user;
    }

    @Transactional(readOnly = true)
    public User findById(Long id) {
        return userRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("user", id));
    }
}
