package com.example.blog.service;

import com.example.blog.common.ResourceNotFoundException;
import com.example.blog.domain.BlogPost;
import com.example.blog.domain.User;
import com.example.blog.domain.UserRole;
import com.example.blog.repository.BlogPostRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PostServiceTest {

    @Mock BlogPostRepository postRepo;
    @Mock UserService userService;

    private PostService service;
    private User admin;
    private User member;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T10:00:00Z"), ZoneOffset.UTC);
        service = new PostService(postRepo, userService, clock);
        admin  = user(1L, "Admin", UserRole.ADMIN);
        member = user(2L, "Alice", UserRole.MEMBER);
    }

    @Test
    void createStampsTodayAndAuthor() {
        when(postRepo.existsByTitle("Title1")).thenReturn(false);
        when(userService.findById(1L)).thenReturn(admin);
        when(postRepo.save(any(BlogPost.class))).thenAnswer(inv -> inv.getArgument(0));

        BlogPost post = service.create("Title1", "Sub", "https://img.example/a.png", "<p>body</p>", 1L);

        assertEquals("October 19, 2026", post.getDate());
        assertSame(admin, post.getAuthor());
        assertEquals("Title1", post.getTitle());
    }

    @Test
    void createRejectsDuplicateTitle() {
        when(postRepo.existsByTitle("Title1")).thenReturn(true);

        assertThrows(DataIntegrityViolationException.class,
                () -> service.create("Title1", "Sub", "https://img.example/a.png", "body", 1L));
        verify(postRepo, never()).save(any());
    }

    @Test
    void updateOverwritesFieldsAndReassignsAuthor() {
        BlogPost post = new BlogPost("Old", "Old sub", "old body", "https://img.example/old.png", member, "January 01, 2026");
        ReflectionTestUtils.setField(post, "id", 5L);
        when(postRepo.findById(5L)).thenReturn(Optional.of(post));
        when(postRepo.existsByTitleAndIdNot("New", 5L)).thenReturn(false);
        when(userService.findById(1L)).thenReturn(admin);

        BlogPost updated = service.update(5L, "New", "New sub", "https://img.example/new.png", "new body", 1L);

        assertSame(post, updated);
        assertEquals(5L, updated.getId());
        assertEquals("New", updated.getTitle());
        assertEquals("New sub", updated.getSubtitle());
        assertEquals("https://img.example/new.png", updated.getImgUrl());
        assertEquals("new body", updated.getBody());
        assertSame(admin, updated.getAuthor());
        assertEquals("January 01, 2026", updated.getDate());
    }

    @Test
    void updateRejectsTitleOfAnotherPost() {
        BlogPost post = new BlogPost("Mine", "sub", "body", "https://img.example/a.png", admin, "January 01, 2026");
        ReflectionTestUtils.setField(post, "id", 5L);
        when(postRepo.findById(5L)).thenReturn(Optional.of(post));
        when(postRepo.existsByTitleAndIdNot("Taken", 5L)).thenReturn(true);

        assertThrows(DataIntegrityViolationException.class,
                () -> service.update(5L, "Taken", "sub", "https://img.example/a.png", "body", 1L));
        assertEquals("Mine", post.getTitle());
    }

    @Test
    void missingPostIsNotFound() {
        when(postRepo.findById(404L)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> service.findById(404L));
        assertThrows(ResourceNotFoundException.class, () -> service.delete(404L));
    }

    private static User user(Long id, String name, UserRole role) {
        User user = new User(name.toLowerCase() + "@x.com", "hash", name, role);
        ReflectionTestUtils.setField(user, "id", id);
        return user;
    }
}
