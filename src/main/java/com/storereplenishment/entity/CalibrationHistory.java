package com.storereplenishment.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(
    name = "calibration_history",
    indexes = {
        @Index(name = "idx_calib_date",  columnList = "calibration_date"),
        @Index(name = "idx_calib_param", columnList = "param_name"),
    }
)
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CalibrationHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @Column(name = "calibration_date", nullable = false)
    private LocalDate calibrationDate;

    @Column(name = "param_name", nullable = false, length = 64)
    private String paramName;

    @Column(name = "old_value", nullable = false)
    private double oldValue;

    @Column(name = "new_value", nullable = false)
    private double newValue;

    @Column(length = 300)
    private String reason;

    @Column(name = "accuracy_before")
    private Double accuracyBefore;

    @Column(name = "sample_size")
    private int sampleSize;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;
}
