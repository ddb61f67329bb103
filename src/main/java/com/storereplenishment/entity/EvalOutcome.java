package com.storereplenishment.entity;

import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.OutcomeClass;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Verdict on one day's decision for one item. Written once, never updated. */
@Entity
@Table(
    name = "eval_outcomes",
    uniqueConstraints = @UniqueConstraint(name = "uk_eval_date_store_item",
                                          columnNames = {"eval_date", "store_id", "item_id"}),
    indexes = {
        @Index(name = "idx_eval_date", columnList = "eval_date"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EvalOutcome {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "eval_date", nullable = false, updatable = false)
    private LocalDate evalDate;

    @Column(name = "store_id", nullable = false, updatable = false, length = 32)
    private String storeId;

    @Column(name = "item_id", nullable = false, updatable = false, length = 32)
    private String itemId;

    @Column(name = "category_group", updatable = false, length = 20)
    private String categoryGroup;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private Decision decision;

    @Column(name = "predicted_qty", updatable = false)
    private int predictedQty;

    @Column(name = "daily_average", updatable = false)
    private double dailyAverage;

    @Column(name = "popularity_score", updatable = false)
    private Double popularityScore;

    @Column(name = "exposure_days", updatable = false)
    private Double exposureDays;

    @Column(name = "stockout_frequency", updatable = false)
    private Double stockoutFrequency;

    @Column(updatable = false)
    private boolean upgraded;

    @Column(name = "actual_sold_qty", updatable = false)
    private int actualSoldQty;

    @Column(name = "next_day_stock", updatable = false)
    private int nextDayStock;

    @Column(name = "was_stockout", updatable = false)
    private boolean wasStockout;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome_class", nullable = false, updatable = false, length = 16)
    private OutcomeClass outcomeClass;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
