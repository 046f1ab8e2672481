package com.lctp.trio.entity;

import com.lctp.trio.enums.QuotaState;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;

/**
 * How many runs a competitor may take in one event/category, and how many were used.
 */
@Entity
@Table(
        name = "participation_quota",
        indexes = {
                @Index(name = "idx_quota_prova_category", columnList = "prova_id,category_id"),
                @Index(name = "idx_quota_may_compete", columnList = "may_compete")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_quota_key", columnNames = {"competitor_id", "prova_id", "category_id"})
        }
)
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"competitor", "prova", "category"})
public class ParticipationQuota {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Integer version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "competitor_id", nullable = false, foreignKey = @ForeignKey(name = "fk_quota_competitor"))
    private Competitor competitor;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prova_id", nullable = false, foreignKey = @ForeignKey(name = "fk_quota_prova"))
    private Prova prova;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false, foreignKey = @ForeignKey(name = "fk_quota_category"))
    private Category category;

    @Column(nullable = false)
    private Integer maxRunsAllowed;

    @Builder.Default
    @Column(nullable = false)
    private Integer runsExecuted = 0;

    @Builder.Default
    @Column(nullable = false)
    private boolean mayCompete = true;

    @Column(length = 500)
    private String blockReason;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    private Instant lastUpdated;

    /* -------------------- Business logic -------------------- */

    public int getRunsRemaining() {
        return Math.max(0, maxRunsAllowed - runsExecuted);
    }

    public QuotaState getState() {
        if (!mayCompete) return QuotaState.BLOCKED;
        if (getRunsRemaining() == 0) return QuotaState.EXHAUSTED;
        return QuotaState.ACTIVE;
    }

    public boolean canCompete() {
        return getState() == QuotaState.ACTIVE;
    }

    public void block(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("A block reason is required");
        }
        this.mayCompete = false;
        this.blockReason = reason.trim();
    }

    public void unblock() {
        this.mayCompete = true;
        this.blockReason = null;
    }
}
