package com.flamingo.ai.personachat.vectorstore;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorProperty;
import co.elastic.clients.elasticsearch._types.mapping.DenseVectorSimilarity;
import co.elastic.clients.elasticsearch._types.mapping.DynamicMapping;
import co.elastic.clients.elasticsearch._types.mapping.Property;
import co.elastic.clients.elasticsearch.core.SearchRequest;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.search.Hit;
import com.flamingo.ai.personachat.exception.SearchException;
import com.google.common.annotations.VisibleForTesting;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Vector store on Elasticsearch dense vectors. Each namespace is its own index, {@code
 * captions-<namespace>}, searched with approximate kNN under cosine similarity.
 */
@Service
@Slf4j
public class ElasticsearchVectorStore implements VectorStore {

  private static final String EMBEDDING_FIELD = "embedding";

  private final ElasticsearchClient elasticsearchClient;
  private final MeterRegistry meterRegistry;
  private final String indexPrefix;
  private final int vectorDimensions;
  private final Set<String> knownIndices = ConcurrentHashMap.newKeySet();

  public ElasticsearchVectorStore(
      ElasticsearchClient elasticsearchClient,
      MeterRegistry meterRegistry,
      @Value("${app.elasticsearch.index-prefix:captions-}") String indexPrefix,
      @Value("${app.elasticsearch.vector-dimensions:1536}") int vectorDimensions) {
    this.elasticsearchClient = elasticsearchClient;
    this.meterRegistry = meterRegistry;
    this.indexPrefix = indexPrefix;
    this.vectorDimensions = vectorDimensions;
  }

  @VisibleForTesting
  String indexName(String namespace) {
    if (namespace == null || namespace.isBlank()) {
      throw new IllegalArgumentException("Vector namespace is required");
    }
    return indexPrefix + namespace.toLowerCase(Locale.ROOT);
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void ensureNamespace(String namespace) {
    String index = indexName(namespace);
    if (knownIndices.contains(index)) {
      return;
    }
    try {
      boolean exists = elasticsearchClient.indices().exists(e -> e.index(index)).value();
      if (!exists) {
        elasticsearchClient
            .indices()
            .create(
                c ->
                    c.index(index)
                        .mappings(
                            m -> m.dynamic(DynamicMapping.False).properties(indexProperties())));
        log.info("Created vector index: {}", index);
      }
      knownIndices.add(index);
    } catch (ElasticsearchException e) {
      if (isAlreadyExists(e)) {
        knownIndices.add(index);
        return;
      }
      throw new SearchException(namespace, "Failed to create index " + index, e);
    } catch (IOException e) {
      throw new SearchException(namespace, "Failed to create index " + index, e);
    }
  }

  private Map<String, Property> indexProperties() {
    Map<String, Property> properties = new HashMap<>();
    properties.put("videoId", Property.of(p -> p.keyword(k -> k)));
    properties.put("personaId", Property.of(p -> p.keyword(k -> k)));
    properties.put("text", Property.of(p -> p.text(t -> t)));
    properties.put("startTime", Property.of(p -> p.double_(d -> d)));
    properties.put(
        EMBEDDING_FIELD,
        Property.of(
            p ->
                p.denseVector(
                    DenseVectorProperty.of(
                        d ->
                            d.dims(vectorDimensions)
                                .index(true)
                                .similarity(DenseVectorSimilarity.Cosine)))));
    return properties;
  }

  @Override
  @Timed(value = "vectorstore.upsert", description = "Time to upsert a caption vector")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void upsert(String namespace, String id, float[] vector, VectorMetadata metadata) {
    ensureNamespace(namespace);
    String index = indexName(namespace);

    CaptionVectorDocument document = CaptionVectorDocument.of(metadata, toList(vector));

    try {
      elasticsearchClient.index(i -> i.index(index).id(id).document(document));
      meterRegistry.counter("vectorstore.upserted").increment();
    } catch (IOException e) {
      throw new SearchException(namespace, "Failed to upsert vector " + id, e);
    }
  }

  @Override
  @Timed(value = "vectorstore.query", description = "Time for vector search")
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public List<VectorMatch> query(String namespace, float[] vector, int topK) {
    String index = indexName(namespace);
    List<Float> queryVector = toList(vector);
    SearchRequest request =
        SearchRequest.of(
            s ->
                s.index(index)
                    .knn(
                        k ->
                            k.field(EMBEDDING_FIELD)
                                .queryVector(queryVector)
                                .k(topK)
                                .numCandidates(Math.max(topK * 2, 20)))
                    .source(src -> src.filter(f -> f.excludes(EMBEDDING_FIELD)))
                    .size(topK));
    try {
      SearchResponse<CaptionVectorDocument> response =
          elasticsearchClient.search(request, CaptionVectorDocument.class);
      List<VectorMatch> matches = new ArrayList<>();
      for (Hit<CaptionVectorDocument> hit : response.hits().hits()) {
        matches.add(toMatch(hit));
      }
      log.debug("Vector search in {} returned {} hits", index, matches.size());
      meterRegistry.counter("vectorstore.queries").increment();
      return matches;
    } catch (ElasticsearchException e) {
      if (e.status() == 404) {
        log.warn("Vector index {} does not exist yet", index);
        return List.of();
      }
      throw new SearchException(namespace, "Vector search failed in " + index, e);
    } catch (IOException e) {
      throw new SearchException(namespace, "Vector search failed in " + index, e);
    }
  }

  @Override
  @CircuitBreaker(name = "elasticsearch")
  @Retry(name = "elasticsearch")
  public void deleteByVideo(String namespace, String videoId) {
    String index = indexName(namespace);
    try {
      elasticsearchClient.deleteByQuery(
          d -> d.index(index).query(q -> q.term(t -> t.field("videoId").value(videoId))));
      log.info("Deleted vectors of video {} from {}", videoId, index);
    } catch (ElasticsearchException e) {
      if (e.status() == 404) {
        return;
      }
      throw new SearchException(namespace, "Failed to delete vectors of " + videoId, e);
    } catch (IOException e) {
      throw new SearchException(namespace, "Failed to delete vectors of " + videoId, e);
    }
  }

  @VisibleForTesting
  static VectorMatch toMatch(Hit<CaptionVectorDocument> hit) {
    CaptionVectorDocument source =
        hit.source() != null ? hit.source() : new CaptionVectorDocument();
    return new VectorMatch(hit.id(), toCosine(hit.score()), source.toMetadata());
  }

  /** Elasticsearch reports cosine kNN scores as {@code (1 + cosine) / 2}. */
  @VisibleForTesting
  static double toCosine(Double score) {
    return score == null ? 0.0 : 2 * score - 1;
  }

  private static boolean isAlreadyExists(ElasticsearchException e) {
    return e.error() != null && "resource_already_exists_exception".equals(e.error().type());
  }

  private static List<Float> toList(float[] vector) {
    List<Float> values = new ArrayList<>(vector.length);
    for (float v : vector) {
      values.add(v);
    }
    return values;
  }
}
