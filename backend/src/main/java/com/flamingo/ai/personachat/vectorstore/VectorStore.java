package com.flamingo.ai.personachat.vectorstore;

import java.util.List;

/**
 * Namespaced store of caption embeddings. Each persona's channel owns one namespace. Upserts are
 * idempotent by vector id.
 */
public interface VectorStore {

  /** Creates the namespace if it does not exist yet. */
  void ensureNamespace(String namespace);

  /**
   * Inserts or replaces a vector.
   *
   * @param namespace target namespace
   * @param id vector id; the caption chunk id
   * @param vector embedding values
   * @param metadata payload stored with the vector
   */
  void upsert(String namespace, String id, float[] vector, VectorMetadata metadata);

  /**
   * Finds the nearest vectors.
   *
   * @return up to {@code topK} matches, best first, scored by cosine similarity
   */
  List<VectorMatch> query(String namespace, float[] vector, int topK);

  /** Removes every vector of a video from the namespace. */
  void deleteByVideo(String namespace, String videoId);
}
