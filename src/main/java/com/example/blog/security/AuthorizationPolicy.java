// src/main/java/com/example/blog/security/AuthorizationPolicy.java
package com.example.blog.security;

import com.example.blog.common.ForbiddenException;
import com.example.blog.config.BlogProperties;
import com.example.blog.domain.Comment;
import com.example.blog.domain.UserRole;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 게시글/댓글 변경 권한 판정.
 * <p>
 * 컨트롤러는 핸들러 첫 줄에서 {@code require*} 가드를 호출한다. 가드가 실패하면
 * {@link ForbiddenException} 이 발생하고 어떤 변경도 일어나지 않는다.
 */
@Component
@RequiredArgsConstructor
public class AuthorizationPolicy {

    private final BlogProperties props;

    /* ───────── 판정 ───────── */

    public boolean isAdministrator(Identity identity) {
        return identity != null
                && identity.isAuthenticated()
                && identity.role() == UserRole.ADMIN;
    }

    /** 삭제 대상 댓글 자체의 작성자인지 확인 */
    public boolean isCommentOwner(Identity identity, Comment comment) {
        if (identity == null || !identity.isAuthenticated() || comment == null) {
            return false;
        }
        return comment.getCommentAuthor() != null
                && Objects.equals(comment.getCommentAuthor().getId(), identity.userId());
    }

    public boolean canDeletePost(Identity identity) {
        return props.getPosts().isPublicDelete() || isAdministrator(identity);
    }

    /* ───────── 가드 ───────── */

    public void requireAdministrator(Identity identity) {
        if (!isAdministrator(identity)) {
            throw new ForbiddenException("administrator required: userId=" + userIdOf(identity));
        }
    }

    public void requireCommentOwner(Identity identity, Comment comment) {
        if (!isCommentOwner(identity, comment)) {
            throw new ForbiddenException("comment owner required: commentId="
                    + (comment == null ? null : comment.getId()) + ", userId=" + userIdOf(identity));
        }
    }

    public void requirePostDeletion(Identity identity) {
        if (!canDeletePost(identity)) {
            throw new ForbiddenException("post deletion not allowed: userId=" + userIdOf(identity));
        }
    }

    private static Long userIdOf(Identity identity) {
        return identity == null ? null : identity.userId();
    }
}
