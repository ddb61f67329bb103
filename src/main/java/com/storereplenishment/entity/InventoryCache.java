package com.storereplenishment.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(
    name = "inventory_cache",
    indexes = @Index(name = "idx_inv_store_item", columnList = "store_id, item_id, queried_at")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class InventoryCache {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "store_id", nullable = false, length = 32)
    private String storeId;

    @Column(name = "item_id", nullable = false, length = 32)
    private String itemId;

    @Column(name = "stock_qty")
    private int stockQty;

    @Column(name = "pending_qty")
    private int pendingQty;

    /** True when read straight from the store system rather than copied from a report. */
    @Column(name = "live")
    private boolean live;

    @Column(name = "queried_at", nullable = false)
    private Instant queriedAt;
}
