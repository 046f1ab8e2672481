package com.lctp.trio.entity;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A competition event.
 */
@Entity
@Table(
        name = "prova",
        indexes = {
                @Index(name = "idx_prova_date_active", columnList = "event_date,active")
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString
public class Prova {

    public static final BigDecimal DEFAULT_PRIZE_DISCOUNT = new BigDecimal("5.0");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = 300, nullable = false)
    private String name;

    @Column(nullable = false)
    private LocalDate eventDate;

    @Column(length = 200)
    private String ranch;

    @Column(length = 100)
    private String city;

    @Column(length = 2)
    private String state;

    @Column(precision = 5, scale = 2)
    @Builder.Default
    private BigDecimal prizeDiscountPercent = DEFAULT_PRIZE_DISCOUNT;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;

    private Instant deletedAt;

    /* -------------------- Business logic -------------------- */

    public boolean isUpcoming(LocalDate today) {
        return active && deletedAt == null && !eventDate.isBefore(today);
    }

    public BigDecimal netPrize(BigDecimal grossPrize) {
        if (grossPrize == null) return null;
        BigDecimal discount = prizeDiscountPercent != null ? prizeDiscountPercent : DEFAULT_PRIZE_DISCOUNT;
        BigDecimal factor = BigDecimal.ONE.subtract(discount.movePointLeft(2));
        return grossPrize.multiply(factor).setScale(2, RoundingMode.HALF_UP);
    }
}
