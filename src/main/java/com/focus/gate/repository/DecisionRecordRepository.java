package com.focus.gate.repository;

import com.focus.gate.model.DecisionRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DecisionRecordRepository extends JpaRepository<DecisionRecord, Long> {

    Optional<DecisionRecord> findFirstByUrlAndMissionHashAndCorrectIsNullOrderByDecidedAtDescIdDesc(
            String url, String missionHash);

    List<DecisionRecord> findByUrlOrderByIdAsc(String url);

    long countByCorrectIsNotNull();
}
