// src/main/java/com/example/blog/web/CommentForm.java
package com.example.blog.web;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;

@Getter @Setter
public class CommentForm {

    @NotBlank(message = "Comment cannot be empty.")
    private String comment;
}
