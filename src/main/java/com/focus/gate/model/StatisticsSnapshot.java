package com.focus.gate.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "decision_statistics")
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StatisticsSnapshot {

    public static final long SINGLETON_ID = 1L;

    // One row, overwritten on every flush
    @Id
    private Long id;

    private long totalDecisions;

    private long cacheHits;

    private long fastPathDecisions;

    private long feedbackCount;

    private long correctDecisions;

    @Column(nullable = false)
    private Instant updatedAt;
}
