package com.storereplenishment.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** Collector-owned daily snapshot per item; read-only for the engine. */
@Entity
@Table(
    name = "daily_sales",
    uniqueConstraints = @UniqueConstraint(name = "uk_sales_store_date_item", columnNames = {"store_id", "sales_date", "item_id"}),
    indexes = {
        @Index(name = "idx_sales_item_date",     columnList = "item_id, sales_date"),
        @Index(name = "idx_sales_category_date", columnList = "category_code, sales_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DailySales {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "store_id", nullable = false, length = 32)
    private String storeId;

    @Column(name = "sales_date", nullable = false)
    private LocalDate salesDate;

    @Column(name = "item_id", nullable = false, length = 32)
    private String itemId;

    @Column(name = "category_code", length = 8)
    private String categoryCode;

    @Column(name = "sale_qty")
    private int saleQty;

    @Column(name = "order_qty")
    private int orderQty;

    @Column(name = "receive_qty")
    private int receiveQty;

    @Column(name = "disuse_qty")
    private int disuseQty;

    @Column(name = "stock_qty")
    private int stockQty;

    @Column(name = "collected_at")
    private Instant collectedAt;
}
