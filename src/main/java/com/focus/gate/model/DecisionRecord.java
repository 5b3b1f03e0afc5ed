package com.focus.gate.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.proxy.HibernateProxy;

import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "decisions", indexes = @Index(name = "idx_decisions_mission_hash", columnList = "mission_hash"))
@Getter
@Setter
@ToString
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DecisionRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 4000)
    private String url;

    @Column(nullable = false, length = 4000)
    private String mission;

    // sha256 of the mission text, used for lookups instead of the long column
    @Column(name = "mission_hash", nullable = false, length = 64)
    private String missionHash;

    @Lob
    @ToString.Exclude
    @Column(nullable = false)
    private byte[] features;

    @Column(nullable = false, length = 16)
    private String featureLayout;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AdmissionAction action;

    private double confidence;

    @Column(nullable = false)
    private Instant decidedAt;

    // Null until feedback arrives, set at most once
    private Boolean correct;

    private Double reward;

    public boolean hasFeedback() {
        return correct != null;
    }

    @Override
    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null) return false;
        Class<?> oEffectiveClass = o instanceof HibernateProxy ? ((HibernateProxy) o).getHibernateLazyInitializer().getPersistentClass() : o.getClass();
        Class<?> thisEffectiveClass = this instanceof HibernateProxy ? ((HibernateProxy) this).getHibernateLazyInitializer().getPersistentClass() : this.getClass();
        if (thisEffectiveClass != oEffectiveClass) return false;
        DecisionRecord that = (DecisionRecord) o;
        return getId() != null && Objects.equals(getId(), that.getId());
    }

    @Override
    public final int hashCode() {
        return this instanceof HibernateProxy ? ((HibernateProxy) this).getHibernateLazyInitializer().getPersistentClass().hashCode() : getClass().hashCode();
    }
}
