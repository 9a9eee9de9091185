package com.flamingo.ai.personachat.vectorstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import co.elastic.clients.elasticsearch.core.search.Hit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ElasticsearchVectorStoreTest {

  @Test
  @DisplayName("Should map kNN scores back to cosine similarity")
  void shouldConvertScores() {
    assertThat(ElasticsearchVectorStore.toCosine(1.0)).isEqualTo(1.0);
    assertThat(ElasticsearchVectorStore.toCosine(0.5)).isEqualTo(0.0);
    assertThat(ElasticsearchVectorStore.toCosine(0.95)).isCloseTo(0.9, within(1e-9));
    assertThat(ElasticsearchVectorStore.toCosine(null)).isEqualTo(0.0);
  }

  @Test
  @DisplayName("Should read match metadata from the typed caption document")
  void shouldMapHitSource() {
    CaptionVectorDocument source =
        CaptionVectorDocument.builder()
            .text("knead for ten minutes")
            .videoId("v1")
            .personaId("p1")
            .startTime(42.5)
            .build();
    Hit<CaptionVectorDocument> hit =
        Hit.of(h -> h.index("captions-ucbake").id("chunk-1").score(0.9).source(source));

    VectorMatch match = ElasticsearchVectorStore.toMatch(hit);

    assertThat(match.id()).isEqualTo("chunk-1");
    assertThat(match.score()).isCloseTo(0.8, within(1e-9));
    assertThat(match.metadata())
        .isEqualTo(new VectorMetadata("knead for ten minutes", "v1", "p1", 42.5));
  }

  @Test
  @DisplayName("Should default a missing start time to zero")
  void shouldDefaultMissingStartTime() {
    Hit<CaptionVectorDocument> hit =
        Hit.of(
            h ->
                h.index("captions-ucbake")
                    .id("chunk-2")
                    .score(0.5)
                    .source(CaptionVectorDocument.builder().videoId("v2").build()));

    assertThat(ElasticsearchVectorStore.toMatch(hit).metadata().startTime()).isZero();
  }
}
