package com.lctp.trio.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Per event/category limit on how many runs each competitor may take.
 */
@Entity
@Table(
        name = "run_configuration",
        uniqueConstraints = {
                @UniqueConstraint(name = "uq_run_config_prova_category", columnNames = {"prova_id", "category_id"})
        }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@ToString(exclude = {"prova", "category"})
public class RunConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "prova_id", nullable = false, foreignKey = @ForeignKey(name = "fk_run_config_prova"))
    private Prova prova;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false, foreignKey = @ForeignKey(name = "fk_run_config_category"))
    private Category category;

    @Column(nullable = false)
    private Integer maxRunsPerCompetitor;

    @Builder.Default
    @Column(nullable = false)
    private boolean active = true;
}
