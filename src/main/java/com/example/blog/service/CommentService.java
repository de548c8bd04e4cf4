// src/main/java/com/example/blog/service/CommentService.java
package com.example.blog.service;

import com.example.blog.common.ResourceNotFoundException;
import com.example.blog.domain.BlogPost;
import com.example.blog.domain.Comment;
import com.example.blog.repository.CommentRepository;
import org.jsoup.Jsoup;
import org.jsoup.safety.Safelist;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional
public class CommentService {

    private final CommentRepository commentRepo;
    private final PostService postService;
    private final UserService userService;

    public CommentService(CommentRepository commentRepo,
                          PostService postService,
                          UserService userService) {
        this.commentRepo = commentRepo;
        this.postService = postService;
        this.userService = userService;
    }

    /** 게시글별 댓글 목록 */
    @Transactional(readOnly = true)
    public List<Comment> findByPost(Long postId) {
        return commentRepo.findByParentPostIdOrderByIdAsc(postId);
    }

    @Transactional(readOnly = true)
    public Comment findById(Long commentId) {
        return commentRepo.findById(commentId)
                .orElseThrow(() -> new ResourceNotFoundException("comment", commentId));
    }

    /** 댓글 작성. 본문은 HTML 로 렌더링되므로 저장 전에 허용 태그만 남긴다. */
    public Comment addComment(Long postId, Long authorId, String text) {
        BlogPost post = postService.findById(postId);
        Comment comment = new Comment(sanitize(text), userService.findById(authorId));
        post.addComment(comment);
        return commentRepo.save(comment);
    }

    static String sanitize(String rawHtml) {
        return Jsoup.clean(rawHtml, Safelist.relaxed());
    }

    /** 댓글 삭제 (해당 댓글 한 건만) */
    public void delete(Long commentId) {
        Comment comment = findById(commentId);
        comment.getParentPost().removeComment(comment);
        commentRepo.delete(comment);
    }
}
