package com.eainde.atc.execution;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AnalysisRunRepository extends JpaRepository<AnalysisRunRecord, String> {

    List<AnalysisRunRecord> findByShiftIdOrderByStartedAtDesc(String shiftId);
}
