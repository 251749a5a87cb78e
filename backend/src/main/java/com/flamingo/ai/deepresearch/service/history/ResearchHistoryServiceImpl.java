package com.flamingo.ai.deepresearch.service.history;

import com.flamingo.ai.deepresearch.domain.entity.HistoryRecord;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import com.flamingo.ai.deepresearch.domain.model.Source;
import com.flamingo.ai.deepresearch.domain.repository.HistoryRecordRepository;
import com.flamingo.ai.deepresearch.exception.EmbeddingDimensionMismatchException;
import com.flamingo.ai.deepresearch.exception.HistoryRecordNotFoundException;
import com.flamingo.ai.deepresearch.exception.ResearchConfigurationException;
import com.flamingo.ai.deepresearch.exception.StoreException;
import com.flamingo.ai.deepresearch.exception.StoreWriteException;
import com.flamingo.ai.deepresearch.service.embedding.EmbeddingService;
import com.flamingo.ai.deepresearch.service.research.ResearchReportComposer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of {@link ResearchHistoryService} on the {@code research_history} table. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchHistoryServiceImpl implements ResearchHistoryService {

  private static final Comparator<SimilarResearch> BY_SIMILARITY_THEN_NEWEST =
      Comparator.comparingDouble(SimilarResearch::similarity)
          .reversed()
          .thenComparing(
              match -> match.record().getStoredAt(), Comparator.reverseOrder());

  private final HistoryRecordRepository historyRecordRepository;
  private final EmbeddingService embeddingService;
  private final MeterRegistry meterRegistry;

  private final ReadWriteLock lock = new ReentrantReadWriteLock();

  @Override
  @Timed(value = "history.save", description = "Time to embed and store a research session")
  public HistoryRecord save(ResearchSession session) {
    if (!session.getStatus().isTerminal()) {
      throw new IllegalStateException("Session " + session.getId() + " is still running");
    }
    float[] embedding = embeddingService.embed(embeddingText(session));

    HistoryRecord record =
        HistoryRecord.builder()
            .sessionId(session.getId())
            .topic(session.getTopic())
            .summary(session.getRunningSummary())
            .finalReport(session.getFinalReport())
            .sourceUrls(
                ResearchReportComposer.citations(session).stream().map(Source::getUrl).toList())
            .embedding(embedding)
            .embeddingDimension(embedding.length)
            .embeddingModel(embeddingService.modelName())
            .loopCount(session.getLoopCount())
            .degraded(session.isDegraded())
            .build();

    lock.writeLock().lock();
    try {
      if (historyRecordRepository.existsById(session.getId())) {
        throw new StoreWriteException(
            session.getId(), "Research session " + session.getId() + " is already stored");
      }
      HistoryRecord saved = historyRecordRepository.saveAndFlush(record);
      meterRegistry.counter("history.saved").increment();
      log.info(
          "Stored research session {} ('{}'), {} sources",
          saved.getSessionId(),
          saved.getTopic(),
          saved.getSourceUrls().size());
      return saved;
    } catch (DataAccessException | TransactionException e) {
      meterRegistry.counter("history.save_failures").increment();
      throw new StoreWriteException(
          session.getId(), "Failed to store research session " + session.getId(), e);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  @Timed(value = "history.query_similar", description = "Time to search similar research")
  public List<SimilarResearch> querySimilar(String text, int topK) {
    if (topK <= 0) {
      throw new IllegalArgumentException("topK must be positive, was " + topK);
    }
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("query text must not be blank");
    }
    float[] queryVector = embeddingService.embed(text);

    List<HistoryRecord> records;
    lock.readLock().lock();
    try {
      records = historyRecordRepository.findAll();
    } catch (DataAccessException e) {
      throw new StoreException("Failed to read research history", e);
    } finally {
      lock.readLock().unlock();
    }

    List<SimilarResearch> matches =
        records.stream()
            .map(record -> new SimilarResearch(record, similarity(queryVector, record)))
            .sorted(BY_SIMILARITY_THEN_NEWEST)
            .limit(topK)
            .toList();
    log.debug("Similarity search over {} records returned {}", records.size(), matches.size());
    return matches;
  }

  @Override
  @Transactional(readOnly = true)
  public HistoryRecord get(UUID sessionId) {
    return historyRecordRepository
        .findById(sessionId)
        .orElseThrow(() -> new HistoryRecordNotFoundException(sessionId));
  }

  @Override
  @Transactional(readOnly = true)
  public List<HistoryRecord> recent(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, was " + limit);
    }
    return historyRecordRepository.findAllByOrderByStoredAtDesc(PageRequest.of(0, limit));
  }

  @Override
  @Transactional(readOnly = true)
  public HistoryStats stats() {
    List<HistoryRecord> newest =
        historyRecordRepository.findAllByOrderByStoredAtDesc(PageRequest.of(0, 1));
    return new HistoryStats(
        historyRecordRepository.count(),
        historyRecordRepository.countByDegradedTrue(),
        embeddingService.modelName(),
        embeddingService.dimension(),
        newest.isEmpty() ? null : newest.get(0).getStoredAt());
  }

  @Override
  public void verifyEmbeddingDimensions() {
    int expected = embeddingService.dimension();
    for (Integer stored : historyRecordRepository.findDistinctEmbeddingDimensions()) {
      if (stored != null && stored != expected) {
        throw new EmbeddingDimensionMismatchException(expected, stored);
      }
    }
    log.info("History store embedding dimension verified: {}", expected);
  }

  private double similarity(float[] queryVector, HistoryRecord record) {
    float[] stored = record.getEmbedding();
    if (stored == null || stored.length != queryVector.length) {
      throw new ResearchConfigurationException(
          String.format(
              "Stored record %s has %d dimensions, query vector has %d",
              record.getSessionId(), stored == null ? 0 : stored.length, queryVector.length));
    }
    return EmbeddingService.cosineSimilarity(queryVector, stored);
  }

  private static String embeddingText(ResearchSession session) {
    String summary = session.getRunningSummary();
    if (summary == null || summary.isBlank()) {
      summary = session.getFinalReport() == null ? "" : session.getFinalReport();
    }
    return session.getTopic() + "\n\n" + summary;
  }
}
