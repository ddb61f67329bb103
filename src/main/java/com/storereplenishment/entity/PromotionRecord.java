package com.storereplenishment.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "promotions",
    indexes = @Index(name = "idx_promo_item", columnList = "store_id, item_id")
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PromotionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "store_id", nullable = false, length = 32)
    private String storeId;

    @Column(name = "item_id", nullable = false, length = 32)
    private String itemId;

    @Column(name = "promo_type", nullable = false, length = 16)
    private String promoType;

    @Column(name = "start_date")
    private LocalDate startDate;

    @Column(name = "end_date")
    private LocalDate endDate;
}
