package com.mockbuster.server.infrastructure.persistence.comment;

import jakarta.persistence.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "film_comments")
public class FilmCommentJpaEntity {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Integer id;

    @Column(name = "film_id", nullable = false)
    private Integer filmId;

    @Column(name = "customer_name", nullable = false, length = 255)
    private String customerName;

    @Column(name = "comment", nullable = false, columnDefinition = "text")
    private String comment;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    protected FilmCommentJpaEntity() {}
    public FilmCommentJpaEntity(Integer filmId, String customerName, String comment) {
        this.filmId = filmId;
        this.customerName = customerName;
        this.comment = comment;
        this.createdAt = LocalDateTime.now();
    }

    public Integer getId() { return id; }
    public Integer getFilmId() { return filmId; }
    public String getCustomerName() { return customerName; }
    public String getComment() { return comment; }
    public LocalDateTime getCreatedAt() { return createdAt; }
}
