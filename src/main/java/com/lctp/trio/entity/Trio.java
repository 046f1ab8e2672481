package com.lctp.trio.entity;

import com.lctp.trio.enums.TrioStatus;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Entity
@Table(
        name = "trio",
        indexes = {
                @Index(name = "idx_trio_prova_category", columnList = "prova_id,category_id")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_trio_number", columnNames = {"prova_id", "category_id", "trio_number"})
        }
)
@EntityListeners(AuditingEntityListener.class)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"prova", "category", "members"})
public class Trio {

    public static final int SIZE = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prova_id", nullable = false, foreignKey = @ForeignKey(name = "fk_trio_prova"))
    private Prova prova;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false, foreignKey = @ForeignKey(name = "fk_trio_category"))
    private Category category;

    @ManyToMany
    @JoinTable(
            name = "trio_member",
            joinColumns = @JoinColumn(name = "trio_id"),
            inverseJoinColumns = @JoinColumn(name = "competitor_id")
    )
    @OrderColumn(name = "pick_order")
    @Builder.Default
    private List<Competitor> members = new ArrayList<>();

    private Integer trioNumber;

    private Integer handicapTotal;

    private Integer ageTotal;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    @Builder.Default
    private TrioStatus status = TrioStatus.ACTIVE;

    @Builder.Default
    @Column(nullable = false)
    private boolean manualFormation = false;

    @CreatedDate
    @Column(updatable = false)
    private Instant createdAt;

    private Instant deletedAt;

    /* -------------------- Business logic -------------------- */

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public List<Long> memberIds() {
        return members.stream().map(Competitor::getId).toList();
    }

    public boolean hasMember(Long competitorId) {
        return members.stream().anyMatch(c -> Objects.equals(c.getId(), competitorId));
    }
}
