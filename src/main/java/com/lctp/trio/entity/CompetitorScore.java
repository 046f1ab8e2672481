package com.lctp.trio.entity;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Stored CONTEP score of a competitor for one event/category.
 */
@Entity
@Table(
        name = "competitor_score",
        indexes = {
                @Index(name = "idx_score_competitor_prova", columnList = "competitor_id,prova_id"),
                @Index(name = "idx_score_prova_category", columnList = "prova_id,category_id")
        }
)
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class CompetitorScore {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long competitorId;

    @Column(nullable = false)
    private Long provaId;

    @Column(nullable = false)
    private Long categoryId;

    private Long trioId;

    private Integer placement;

    @Column(precision = 8, scale = 2, nullable = false)
    private BigDecimal placementPoints;

    @Column(precision = 8, scale = 2, nullable = false)
    private BigDecimal prizePoints;

    @Column(precision = 8, scale = 2, nullable = false)
    private BigDecimal totalPoints;

    @Column(precision = 12, scale = 2)
    private BigDecimal prizeShare;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;
}
