// src/main/java/com/example/blog/web/CommentController.java
package com.example.blog.web;

import com.example.blog.domain.Comment;
import com.example.blog.security.AuthorizationPolicy;
import com.example.blog.security.Identity;
import com.example.blog.service.CommentService;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

@Controller
public class CommentController {

    private final CommentService commentService;
    private final AuthorizationPolicy policy;

    public CommentController(CommentService commentService,
                             AuthorizationPolicy policy) {
        this.commentService = commentService;
        this.policy = policy;
    }

    /* 댓글 삭제 (작성자 본인만) */
    @GetMapping("/delete_comment/{commentId}/{postId}")
    public String delete(@PathVariable Long commentId,
                         @PathVariable Long postId,
                         Identity identity) {
        Comment comment = commentService.findById(commentId);
        policy.requireCommentOwner(identity, comment);
        commentService.delete(commentId);
        return "redirect:/post/" + postId;
    }
}
