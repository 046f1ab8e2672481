package com.lctp.trio.entity;

import com.lctp.trio.enums.Sex;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;

@Entity
@Table(
        name = "competitor",
        indexes = {
                @Index(name = "idx_competitor_name", columnList = "name"),
                @Index(name = "idx_competitor_handicap_birth", columnList = "handicap,birth_date"),
                @Index(name = "idx_competitor_category", columnList = "category_id")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = "category")
public class Competitor {

    public static final int MIN_HANDICAP = 0;
    public static final int MAX_HANDICAP = 7;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 300, nullable = false)
    private String name;

    @Column(nullable = false)
    private LocalDate birthDate;

    @Column(nullable = false)
    @Builder.Default
    private Integer handicap = 0;

    @Enumerated(EnumType.STRING)
    @Column(length = 1, nullable = false)
    private Sex sex;

    @Column(length = 100)
    private String city;

    @Column(length = 2)
    private String state;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "category_id", foreignKey = @ForeignKey(name = "fk_competitor_category"))
    private Category category;

    private Instant deletedAt;

    /* -------------------- Business logic -------------------- */

    public int ageAt(LocalDate date) {
        return Period.between(birthDate, date).getYears();
    }

    public boolean hasValidHandicap() {
        return handicap != null && handicap >= MIN_HANDICAP && handicap <= MAX_HANDICAP;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
