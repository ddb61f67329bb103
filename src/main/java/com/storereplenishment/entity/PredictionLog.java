package com.storereplenishment.entity;

import com.storereplenishment.domain.ConfidenceTier;
import com.storereplenishment.domain.Decision;
import com.storereplenishment.domain.InventorySource;
import com.storereplenishment.domain.PendingMode;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * One row per item per run. Stock and pending provenance are kept so that the
 * prediction-time and order-time inventory views can be compared later.
 */
@Entity
@Table(
    name = "prediction_logs",
    indexes = {
        @Index(name = "idx_plog_run",      columnList = "run_id"),
        @Index(name = "idx_plog_date",     columnList = "target_date"),
        @Index(name = "idx_plog_item",     columnList = "item_id"),
        @Index(name = "idx_plog_created",  columnList = "created_at"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PredictionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    @Column(name = "store_id", nullable = false, length = 32)
    private String storeId;

    @Column(name = "target_date", nullable = false)
    private LocalDate targetDate;

    @Column(name = "item_id", nullable = false, length = 32)
    private String itemId;

    @Column(name = "category_code", length = 16)
    private String categoryCode;

    @Column(name = "category_group", length = 20)
    private String categoryGroup;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private PredictionStatus status;

    @Column(name = "error_message", length = 500)
    private String errorMessage;

    @Column(name = "baseline_qty")
    private double baselineQty;

    @Column(name = "adjusted_qty")
    private double adjustedQty;

    @Column(name = "forecast_qty")
    private double forecastQty;

    @Column(name = "model_forecast")
    private Double modelForecast;

    @Column(name = "model_weight")
    private double modelWeight;

    @Column(name = "daily_average")
    private double dailyAverage;

    @Column(name = "safety_stock")
    private double safetyStock;

    @Column(name = "stock_qty")
    private int stockQty;

    @Column(name = "pending_qty")
    private int pendingQty;

    @Enumerated(EnumType.STRING)
    @Column(name = "stock_source", length = 16)
    private InventorySource stockSource;

    @Enumerated(EnumType.STRING)
    @Column(name = "pending_source", length = 16)
    private PendingMode pendingSource;

    @Column(name = "is_stock_stale")
    private boolean stockStale;

    @Enumerated(EnumType.STRING)
    @Column(name = "confidence_tier", length = 8)
    private ConfidenceTier confidenceTier;

    @Column(name = "order_qty")
    private int orderQty;

    @Column(name = "final_order_qty")
    private int finalOrderQty;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private Decision decision;

    @Column(name = "decision_reason", length = 500)
    private String decisionReason;

    @Column(name = "exposure_days")
    private Double exposureDays;

    @Column(name = "popularity_score")
    private Double popularityScore;

    @Column(name = "stockout_frequency")
    private Double stockoutFrequency;

    @Column(name = "upgraded")
    private boolean upgraded;

    @Column(name = "order_time_stock")
    private Integer orderTimeStock;

    @Column(name = "order_time_pending")
    private Integer orderTimePending;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
