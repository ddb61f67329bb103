package com.storereplenishment.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

@Entity
@Table(name = "calibration_parameters")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalibrationParameter {

    @Id
    @Column(name = "param_name", length = 64)
    private String paramName;

    @Column(name = "current_value", nullable = false)
    private double currentValue;

    @Column(name = "default_value", nullable = false)
    private double defaultValue;

    @Column(name = "min_value", nullable = false)
    private double minValue;

    @Column(name = "max_value", nullable = false)
    private double maxValue;

    @Column(name = "last_adjusted_reason", length = 300)
    private String lastAdjustedReason;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;
}
