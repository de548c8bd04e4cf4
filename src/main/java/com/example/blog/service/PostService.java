// src/main/java/com/example/blog/service/PostService.java
package com.example.blog.service;

import com.example.blog.common.ResourceNotFoundException;
import com.example.blog.domain.BlogPost;
import com.example.blog.domain.User;
import com.example.blog.repository.BlogPostRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@Transactional
@RequiredArgsConstructor
public class PostService {

    /** 발행일 표기: "October 19, 2026" */
    static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM dd, yyyy", Locale.US);

    private final BlogPostRepository postRepo;
    private final UserService userService;
    private final Clock clock;

    /* ───────────────── 조회 ───────────────── */
    @Transactional(readOnly = true)
    public List<BlogPost> findAll() {
        return postRepo.findAllByOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public BlogPost findById(Long id) {
        return postRepo.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("post", id));
    }

    /* ───────────────── 생성 ───────────────── */
    /**
     * 새 게시글 저장. 작성자는 현재 사용자, 발행일은 오늘.
     *
     * @throws DataIntegrityViolationException 제목 중복 시
     */
    public BlogPost create(String title, String subtitle, String imgUrl, String body, Long authorId) {
        if (postRepo.existsByTitle(title)) {
            throw new DataIntegrityViolationException("이미 존재하는 제목입니다: " + title);
        }
        User author = userService.findById(authorId);
        String date = LocalDate.now(clock).format(DATE_FORMAT);
        BlogPost post = postRepo.save(new BlogPost(title, subtitle, body, imgUrl, author, date));
        log.info("📝 게시글 등록: id={}, title='{}', authorId={}", post.getId(), title, authorId);
        return post;
    }

    /* ───────────────── 수정 / 삭제 ───────────────── */
    /**
     * 제목·부제·이미지·본문을 덮어쓰고 작성자를 수정한 사용자로 바꾼다.
     * id 와 발행일은 유지된다.
     *
     * @throws DataIntegrityViolationException 다른 게시글과 제목이 겹칠 때
     */
    public BlogPost update(Long id, String title, String subtitle, String imgUrl, String body, Long editorId) {
        BlogPost post = findById(id);
        if (postRepo.existsByTitleAndIdNot(title, id)) {
            throw new DataIntegrityViolationException("이미 존재하는 제목입니다: " + title);
        }
        post.setTitle(title);
        post.setSubtitle(subtitle);
        post.setImgUrl(imgUrl);
        post.setBody(body);
        post.setAuthor(userService.findById(editorId));
        // JPA dirty checking → 자동 반영
        log.info("✏️ 게시글 수정: id={}, editorId={}", id, editorId);
        return post;
    }

    /** 게시글과 달린 댓글을 함께 삭제 */
    public void delete(Long id) {
        BlogPost post = findById(id);
        int comments = post.getComments().size();
        postRepo.delete(post);
        log.info("🗑️ 게시글 삭제: id={} (댓글 {}개 함께 삭제)", id, comments);
    }
}
