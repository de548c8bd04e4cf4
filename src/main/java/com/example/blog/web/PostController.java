// src/main/java/com/example/blog/web/PostController.java
package com.example.blog.web;

import com.example.blog.domain.BlogPost;
import com.example.blog.security.AuthorizationPolicy;
import com.example.blog.security.Identity;
import com.example.blog.service.CommentService;
import com.example.blog.service.PostService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.validation.BindingResult;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * 게시글 목록/상세 + 댓글 작성 + 관리자 전용 작성·수정·삭제
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class PostController {

    static final String MSG_LOGIN_TO_COMMENT = "You must login or register to comment.";
    static final String MSG_DUPLICATE_TITLE  = "A post with that title already exists.";

    private final PostService         postService;
    private final CommentService      commentService;
    private final AuthorizationPolicy policy;

    /* (1) 게시글 목록 */
    @GetMapping("/")
    public String list(Model model) {
        model.addAttribute("allPosts", postService.findAll());
        return "index";
    }

    /* (2) 게시글 상세 + 댓글 목록 */
    @GetMapping("/post/{postId}")
    public String show(@PathVariable Long postId, Model model) {
        model.addAttribute("commentForm", new CommentForm());
        return renderPost(postId, model);
    }

    /* (3) 댓글 등록 (로그인 필요) */
    @PostMapping("/post/{postId}")
    public String addComment(@PathVariable Long postId,
                             @ModelAttribute("commentForm") @Valid CommentForm form,
                             BindingResult bindingResult,
                             Identity identity,
                             Model model,
                             RedirectAttributes rttr) {
        postService.findById(postId); // 없는 게시글이면 로그인·검증보다 먼저 404
        if (bindingResult.hasErrors()) {
            return renderPost(postId, model);
        }
        if (!identity.isAuthenticated()) {
            rttr.addFlashAttribute("flash", MSG_LOGIN_TO_COMMENT);
            return "redirect:/login";
        }
        commentService.addComment(postId, identity.userId(), form.getComment());
        return "redirect:/post/" + postId;
    }

    /* (4) 새 게시글 폼 (관리자) */
    @GetMapping("/new-post")
    public String createForm(Identity identity, Model model) {
        policy.requireAdministrator(identity);
        model.addAttribute("postForm", new PostForm());
        model.addAttribute("isEdit", false);
        return "make-post";
    }

    /* (5) 새 게시글 저장 (관리자) */
    @PostMapping("/new-post")
    public String create(Identity identity,
                         @ModelAttribute("postForm") @Valid PostForm form,
                         BindingResult bindingResult,
                         Model model) {
        policy.requireAdministrator(identity);
        model.addAttribute("isEdit", false);
        if (bindingResult.hasErrors()) {
            return "make-post";
        }
        try {
            postService.create(form.getTitle(), form.getSubtitle(), form.getImgUrl(), form.getBody(),
                    identity.userId());
        } catch (DataIntegrityViolationException ex) {
            bindingResult.rejectValue("title", "duplicate", MSG_DUPLICATE_TITLE);
            return "make-post";
        }
        return "redirect:/";
    }

    /* (6) 게시글 수정 폼 (관리자) */
    @GetMapping("/edit-post/{postId}")
    public String editForm(@PathVariable Long postId, Identity identity, Model model) {
        policy.requireAdministrator(identity);
        BlogPost post = postService.findById(postId);
        model.addAttribute("postForm", PostForm.from(post));
        model.addAttribute("postId", postId);
        model.addAttribute("isEdit", true);
        return "make-post";
    }

    /* (7) 게시글 수정 처리 (관리자) */
    @PostMapping("/edit-post/{postId}")
    public String edit(@PathVariable Long postId,
                       Identity identity,
                       @ModelAttribute("postForm") @Valid PostForm form,
                       BindingResult bindingResult,
                       Model model) {
        policy.requireAdministrator(identity);
        postService.findById(postId);
        model.addAttribute("postId", postId);
        model.addAttribute("isEdit", true);
        if (bindingResult.hasErrors()) {
            return "make-post";
        }
        try {
            postService.update(postId, form.getTitle(), form.getSubtitle(), form.getImgUrl(), form.getBody(),
                    identity.userId());
        } catch (DataIntegrityViolationException ex) {
            bindingResult.rejectValue("title", "duplicate", MSG_DUPLICATE_TITLE);
            return "make-post";
        }
        return "redirect:/post/" + postId;
    }

    /*
     * (8) 게시글 삭제.
     * 기본은 관리자 전용이며 blog.posts.public-delete=true 일 때만 누구나 삭제 가능.
     */
    @GetMapping("/delete/{postId}")
    public String delete(@PathVariable Long postId, Identity identity) {
        policy.requirePostDeletion(identity);
        postService.delete(postId);
        return "redirect:/";
    }

    private String renderPost(Long postId, Model model) {
        model.addAttribute("post", postService.findById(postId));
        model.addAttribute("comments", commentService.findByPost(postId));
        return "post";
    }
}
