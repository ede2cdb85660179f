package com.poc.eurverifier.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "verification_runs")
@Data
@NoArgsConstructor
public class VerificationRun {

    public static final int CHECKED_COLUMNS_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String sourceFileName;

    @Column(nullable = false)
    private String targetFileName;

    @Column(nullable = false, length = 64)
    private String sourceSha256;

    @Column(nullable = false, length = 64)
    private String targetSha256;

    private String sourceSheet;

    private String targetSheet;

    @Column(length = CHECKED_COLUMNS_LENGTH)
    private String checkedColumns;

    @Column(nullable = false)
    private boolean passed;

    private int checkedCount;

    private int skippedCount;

    private int discrepancyCount;

    // Relative to the storage root; null when the run passed
    private String reportFileName;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
