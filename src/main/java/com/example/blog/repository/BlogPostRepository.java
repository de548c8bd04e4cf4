// src/main/java/com/example/blog/repository/BlogPostRepository.java
package com.example.blog.repository;

import com.example.blog.domain.BlogPost;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BlogPostRepository extends JpaRepository<BlogPost, Long> {

    /** 등록 순서(id 오름차순) 그대로의 전체 목록 */
    List<BlogPost> findAllByOrderByIdAsc();

    boolean existsByTitle(String title);

    /** 수정 시 자기 자신을 제외한 제목 중복 검사 */
    boolean existsByTitleAndIdNot(String title, Long id);
}
