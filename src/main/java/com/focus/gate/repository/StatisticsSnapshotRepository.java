package com.focus.gate.repository;

import com.focus.gate.model.StatisticsSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StatisticsSnapshotRepository extends JpaRepository<StatisticsSnapshot, Long> {
}
