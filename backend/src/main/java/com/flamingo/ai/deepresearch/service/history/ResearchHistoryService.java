package com.flamingo.ai.deepresearch.service.history;

import com.flamingo.ai.deepresearch.domain.entity.HistoryRecord;
import com.flamingo.ai.deepresearch.domain.model.ResearchSession;
import java.util.List;
import java.util.UUID;

/**
 * Append-only store of finished research sessions with similarity search over their embeddings.
 *
 * <p>Writes are serialized; reads run concurrently.
 */
public interface ResearchHistoryService {

  /**
   * Embeds the session's topic and summary and appends a record.
   *
   * @param session a finished session
   * @return the stored record
   * @throws com.flamingo.ai.deepresearch.exception.StoreWriteException if the session is already
   *     stored or the write fails
   * @throws com.flamingo.ai.deepresearch.exception.EmbeddingException if embedding fails
   */
  HistoryRecord save(ResearchSession session);

  /**
   * Finds the stored sessions most similar to {@code text}.
   *
   * @param text query text
   * @param topK maximum number of results; larger than the store returns every record
   * @return records by descending cosine similarity, ties newest first
   * @throws IllegalArgumentException if {@code topK <= 0}
   */
  List<SimilarResearch> querySimilar(String text, int topK);

  /**
   * Gets a stored record.
   *
   * @throws com.flamingo.ai.deepresearch.exception.HistoryRecordNotFoundException if not found
   */
  HistoryRecord get(UUID sessionId);

  /** Newest records first. */
  List<HistoryRecord> recent(int limit);

  HistoryStats stats();

  /**
   * Checks every stored vector against the configured embedding dimension.
   *
   * @throws com.flamingo.ai.deepresearch.exception.EmbeddingDimensionMismatchException on the
   *     first stored dimension that differs
   */
  void verifyEmbeddingDimensions();
}
