// src/main/java/com/example/blog/repository/CommentRepository.java
package com.example.blog.repository;

import com.example.blog.domain.Comment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CommentRepository extends JpaRepository<Comment, Long> {

    /** 게시글별 댓글 (작성 순) */
    List<Comment> findByParentPostIdOrderByIdAsc(Long postId);
}
