// src/main/java/com/example/blog/domain/User.java
package com.example.blog.domain;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 블로그 회원 엔티티.
 * 이메일이 로그인 ID 역할을 하며, 권한은 {@link UserRole} 컬럼으로 관리한다.
 */
@Entity
@Table(
        name = "users",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_users_email", columnNames = "email"),
                @UniqueConstraint(name = "uk_users_admin_slot", columnNames = "admin_slot")
        }
)
@Getter @Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String email;

    /** 해시된 비밀번호 */
    @Column(nullable = false)
    private String password;

    @Column(nullable = false, length = 1000)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private UserRole role = UserRole.MEMBER;

    /**
     * 관리자 행만 TRUE, 나머지는 NULL. 유니크 제약으로 관리자가 두 명 생기는 것을 DB 에서 막는다.
     */
    @Column(name = "admin_slot")
    private Boolean adminSlot;

    @CreationTimestamp
    private LocalDateTime createdAt;

    /* ─── 관계 (읽기 전용) ─────────────────── */

    @OneToMany(mappedBy = "author")
    @OrderBy("id ASC")
    private List<BlogPost> posts = new ArrayList<>();

    @OneToMany(mappedBy = "commentAuthor")
    @OrderBy("id ASC")
    private List<Comment> comments = new ArrayList<>();

    public User(String email, String password, String name, UserRole role) {
        this.email    = email;
        this.password = password;
        this.name     = name;
        this.role     = role;
        this.adminSlot = (role == UserRole.ADMIN) ? Boolean.TRUE : null;
    }
}
