// src/main/java/com/example/blog/domain/BlogPost.java
package com.example.blog.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Table(
        name = "blog_posts",
        uniqueConstraints = @UniqueConstraint(name = "uk_blog_posts_title", columnNames = "title")
)
@Getter @Setter @NoArgsConstructor
public class BlogPost {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 250)
    private String title;

    @Column(nullable = false, length = 250)
    private String subtitle;

    /** 발행일. "October 19, 2026" 형식의 문자열로 보관 */
    @Column(nullable = false, length = 250)
    private String date;

    @Lob
    @Column(nullable = false)
    private String body;

    @Column(name = "img_url", nullable = false, length = 250)
    private String imgUrl;

    /* ─── 관계 ─────────────────────────────── */

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false)
    private User author;

    /** 게시글 삭제 시 댓글도 함께 삭제된다 */
    @OneToMany(mappedBy = "parentPost",
            cascade = CascadeType.ALL,
            orphanRemoval = true)
    @OrderBy("id ASC")
    private List<Comment> comments = new ArrayList<>();

    public BlogPost(String title, String subtitle, String body, String imgUrl, User author, String date) {
        this.title    = title;
        this.subtitle = subtitle;
        this.body     = body;
        this.imgUrl   = imgUrl;
        this.author   = author;
        this.date     = date;
    }

    public void addComment(Comment comment) {
        comments.add(comment);
        comment.setParentPost(this);
    }

    public void removeComment(Comment comment) {
        comments.remove(comment);
    }
}
