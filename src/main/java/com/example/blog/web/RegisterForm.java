// src/main/java/com/example/blog/web/RegisterForm.java
package com.example.blog.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.Setter;

/**
 * 회원가입 폼 DTO
 */
@Getter @Setter
public class RegisterForm {

    @NotBlank(message = "Email is required.")
    @Size(max = 100, message = "Email must be at most {max} characters.")
    private String email;

    @NotBlank(message = "Password is required.")
    private String password;

    @NotBlank(message = "Name is required.")
    @Size(max = 1000, message = "Name must be at most {max} characters.")
    private String name;
}
