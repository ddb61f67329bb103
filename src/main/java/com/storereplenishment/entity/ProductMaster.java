package com.storereplenishment.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "product_master")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProductMaster {

    @Id
    @Column(name = "item_id", length = 32)
    private String itemId;

    @Column(name = "item_name", length = 200)
    private String itemName;

    @Column(name = "category_code", nullable = false, length = 8)
    private String categoryCode;

    @Column(name = "shelf_life_days")
    private int shelfLifeDays;

    @Column(name = "order_unit")
    private int orderUnit;

    @Column(name = "margin_rate")
    private double marginRate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private ProductStatus status = ProductStatus.ACTIVE;

    @Column(name = "manual_exclude")
    private boolean manualExclude;

    public enum ProductStatus {
        ACTIVE,
        DISCONTINUED,
        ON_HOLD
    }
}
