// src/main/java/com/example/blog/domain/Comment.java
package com.example.blog.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "comments")
@Getter @Setter @NoArgsConstructor
public class Comment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Lob
    @Column(nullable = false)
    private String text;

    /* ─── 관계 ─────────────────────────────── */

    /** ↩ 다수 댓글 → 한 명의 작성자 */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "comment_author_id", nullable = false)
    private User commentAuthor;

    /** ↩ 다수 댓글 → 하나의 게시글 */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "parent_post_id", nullable = false)
    private BlogPost parentPost;

    public Comment(String text, User commentAuthor) {
        this.text          = text;
        this.commentAuthor = commentAuthor;
    }
}
