package com.lctp.trio.entity;

import com.lctp.trio.enums.ExclusionKind;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Timed outcome of one trio in its event/category.
 */
@Entity
@Table(
        name = "run_result",
        indexes = {
                @Index(name = "idx_result_prova", columnList = "prova_id"),
                @Index(name = "idx_result_placement", columnList = "placement")
        },
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_result_trio", columnNames = {"trio_id"})
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"trio", "prova"})
public class RunResult {

    public static final int TIME_SCALE = 3;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Version
    private Integer version;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "trio_id", nullable = false, foreignKey = @ForeignKey(name = "fk_result_trio"))
    private Trio trio;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prova_id", nullable = false, foreignKey = @ForeignKey(name = "fk_result_prova"))
    private Prova prova;

    @Column(precision = 8, scale = 3)
    private BigDecimal firstAttemptTime;

    @Column(precision = 8, scale = 3)
    private BigDecimal secondAttemptTime;

    @Column(precision = 8, scale = 3)
    private BigDecimal averageTime;

    private Integer placement;

    @Column(precision = 12, scale = 2)
    private BigDecimal prizeAmount;

    @Column(precision = 12, scale = 2)
    private BigDecimal netPrizeAmount;

    @Builder.Default
    @Column(nullable = false)
    private boolean noTime = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean disqualified = false;

    @Builder.Default
    @Column(nullable = false)
    private boolean recorded = false;

    @Column(length = 1000)
    private String notes;

    /* -------------------- Business logic -------------------- */

    public static boolean isValidAttempt(BigDecimal time) {
        return time != null && time.signum() > 0;
    }

    /**
     * Average of the valid attempts, null when there is none.
     */
    public void recalculateAverage() {
        var valid = validAttempts().toList();
        if (valid.isEmpty()) {
            this.averageTime = null;
            return;
        }
        BigDecimal sum = valid.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        this.averageTime = sum.divide(BigDecimal.valueOf(valid.size()), TIME_SCALE, RoundingMode.HALF_UP);
    }

    public Optional<BigDecimal> bestAttempt() {
        return validAttempts().min(Comparator.naturalOrder());
    }

    public boolean isTimed() {
        return averageTime != null && !noTime && !disqualified;
    }

    public ExclusionKind exclusionKind() {
        if (disqualified) return ExclusionKind.DISQUALIFIED;
        if (!isTimed()) return ExclusionKind.NO_TIME;
        return ExclusionKind.TIMED;
    }

    private Stream<BigDecimal> validAttempts() {
        return Stream.of(firstAttemptTime, secondAttemptTime)
                .filter(Objects::nonNull)
                .filter(RunResult::isValidAttempt);
    }
}
