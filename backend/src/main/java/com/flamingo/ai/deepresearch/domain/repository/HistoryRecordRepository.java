package com.flamingo.ai.deepresearch.domain.repository;

import com.flamingo.ai.deepresearch.domain.entity.HistoryRecord;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

/** Repository for HistoryRecord entities. */
@Repository
public interface HistoryRecordRepository extends JpaRepository<HistoryRecord, UUID> {

  /** Finds the newest records first. */
  List<HistoryRecord> findAllByOrderByStoredAtDesc(Pageable pageable);

  long countByDegradedTrue();

  /** Distinct vector dimensions present in the store. */
  @Query("SELECT DISTINCT r.embeddingDimension FROM HistoryRecord r")
  List<Integer> findDistinctEmbeddingDimensions();
}
