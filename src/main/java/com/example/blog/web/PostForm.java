// src/main/java/com/example/blog/web/PostForm.java
package com.example.blog.web;

import com.example.blog.domain.BlogPost;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.validator.constraints.URL;

/**
 * 게시글 작성·수정 공용 폼
 */
@Getter @Setter
@NoArgsConstructor
public class PostForm {

    @NotBlank(message = "Title is required.")
    @Size(max = 250, message = "Title must be at most {max} characters.")
    private String title;

    @NotBlank(message = "Subtitle is required.")
    @Size(max = 250, message = "Subtitle must be at most {max} characters.")
    private String subtitle;

    @NotBlank(message = "Image URL is required.")
    @URL(message = "Invalid URL.")
    @Size(max = 250, message = "Image URL must be at most {max} characters.")
    private String imgUrl;

    @NotBlank(message = "Content is required.")
    private String body;

    /** 수정 폼 초기값 채우기 */
    public static PostForm from(BlogPost post) {
        PostForm form = new PostForm();
        form.setTitle(post.getTitle());
        form.setSubtitle(post.getSubtitle());
        form.setImgUrl(post.getImgUrl());
        form.setBody(post.getBody());
        return form;
    }
}
