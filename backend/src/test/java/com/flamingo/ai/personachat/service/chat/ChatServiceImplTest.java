package com.flamingo.ai.personachat.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.personachat.agent.ChatStreamingAgent;
import com.flamingo.ai.personachat.api.dto.request.ChatRequest;
import com.flamingo.ai.personachat.api.dto.response.ChatStreamEvent;
import com.flamingo.ai.personachat.config.PipelineConfig;
import com.flamingo.ai.personachat.domain.entity.ChatMessage;
import com.flamingo.ai.personachat.domain.entity.ChatSession;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.entity.Video;
import com.flamingo.ai.personachat.domain.enums.MessageRole;
import com.flamingo.ai.personachat.domain.model.VideoReference;
import com.flamingo.ai.personachat.domain.repository.PersonaRepository;
import com.flamingo.ai.personachat.domain.repository.VideoRepository;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.exception.SearchException;
import com.flamingo.ai.personachat.service.embedding.EmbeddingService;
import com.flamingo.ai.personachat.vectorstore.VectorMatch;
import com.flamingo.ai.personachat.vectorstore.VectorMetadata;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.service.TokenStream;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

@ExtendWith(MockitoExtension.class)
class ChatServiceImplTest {

  @Mock private PersonaRepository personaRepository;
  @Mock private VideoRepository videoRepository;
  @Mock private ChatSessionService chatSessionService;
  @Mock private EmbeddingService embeddingService;
  @Mock private VectorStore vectorStore;
  @Mock private ChatStreamingAgent chatStreamingAgent;
  @Mock private CitationService citationService;

  private SimpleMeterRegistry meterRegistry;
  private ChatServiceImpl chatService;
  private Persona persona;
  private ChatSession session;
  private UUID assistantMessageId;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    chatService =
        new ChatServiceImpl(
            personaRepository,
            videoRepository,
            chatSessionService,
            embeddingService,
            vectorStore,
            chatStreamingAgent,
            citationService,
            new PipelineConfig(),
            meterRegistry);

    persona =
        Persona.builder()
            .id(UUID.randomUUID())
            .username("bakewithme")
            .channelId("UCBake")
            .title("Bake With Me")
            .description("Bread every week")
            .build();
    session = ChatSession.builder().id(UUID.randomUUID()).persona(persona).title("Bread").build();
    assistantMessageId = UUID.randomUUID();

    lenient().when(personaRepository.findById(persona.getId())).thenReturn(Optional.of(persona));
    lenient()
        .when(chatSessionService.resolveSession(eq(persona), any(), any(), anyString()))
        .thenReturn(session);
    lenient()
        .when(
            chatSessionService.appendMessage(
                eq(session), any(), eq(MessageRole.ASSISTANT), anyString(), any()))
        .thenReturn(ChatMessage.builder().id(assistantMessageId).build());
  }

  /** Callbacks registered on a mocked TokenStream, driven by the test. */
  private static final class StreamCallbacks {
    final AtomicReference<Consumer<String>> onPartial = new AtomicReference<>();
    final AtomicReference<Consumer<ChatResponse>> onComplete = new AtomicReference<>();
    final AtomicReference<Consumer<Throwable>> onError = new AtomicReference<>();
  }

  /** Builds a TokenStream whose start() does nothing; the test fires the callbacks. */
  private TokenStream capturingStream(StreamCallbacks callbacks) {
    TokenStream stream = mock(TokenStream.class);
    when(stream.onPartialResponse(any()))
        .thenAnswer(
            invocation -> {
              callbacks.onPartial.set(invocation.getArgument(0));
              return stream;
            });
    lenient()
        .when(stream.onCompleteResponse(any()))
        .thenAnswer(
            invocation -> {
              callbacks.onComplete.set(invocation.getArgument(0));
              return stream;
            });
    when(stream.onError(any()))
        .thenAnswer(
            invocation -> {
              callbacks.onError.set(invocation.getArgument(0));
              return stream;
            });
    return stream;
  }

  /** Builds a TokenStream that replays the given tokens and then completes or fails. */
  private TokenStream tokenStream(List<String> tokens, Throwable failure) {
    StreamCallbacks callbacks = new StreamCallbacks();
    TokenStream stream = capturingStream(callbacks);
    doAnswer(
            invocation -> {
              tokens.forEach(token -> callbacks.onPartial.get().accept(token));
              if (failure != null) {
                callbacks.onError.get().accept(failure);
              } else {
                callbacks.onComplete.get().accept(null);
              }
              return null;
            })
        .when(stream)
        .start();
    return stream;
  }

  private VectorMatch match(String videoId, double startTime, double score) {
    return new VectorMatch(
        UUID.randomUUID().toString(),
        score,
        new VectorMetadata(
            "excerpt of " + videoId, videoId, persona.getId().toString(), startTime));
  }

  @Nested
  @DisplayName("streamChat")
  class StreamChatTests {

    @Test
    @DisplayName("Should stream content, then references, then complete")
    void shouldStreamInOrder() {
      when(embeddingService.embedQuery("How long do I proof?")).thenReturn(new float[] {1f});
      when(vectorStore.query(eq("ucbake"), any(), eq(10)))
          .thenReturn(List.of(match("v1", 95, 0.9)));
      when(videoRepository.findByPersonaIdAndExternalVideoIdIn(eq(persona.getId()), any()))
          .thenReturn(List.of(Video.builder().externalVideoId("v1").title("Proofing").build()));
      when(chatStreamingAgent.chat(anyList()))
          .thenReturn(tokenStream(List.of("About ", "two hours."), null));
      List<VideoReference> references =
          List.of(new VideoReference("v1", 95, 0.8, "Proofing"));
      when(citationService.extractReferences(eq("About two hours."), anyList()))
          .thenReturn(references);

      StepVerifier.create(
              chatService.streamChat(
                  persona.getId(), ChatRequest.builder().message("How long do I proof?").build()))
          .expectNext(ChatStreamEvent.content("About "))
          .expectNext(ChatStreamEvent.content("two hours."))
          .expectNext(ChatStreamEvent.references(references))
          .expectNext(ChatStreamEvent.complete(assistantMessageId, session.getId()))
          .verifyComplete();

      verify(chatSessionService)
          .appendMessage(session, null, MessageRole.USER, "How long do I proof?", null);
      verify(chatSessionService)
          .appendMessage(session, null, MessageRole.ASSISTANT, "About two hours.", references);
    }

    @Test
    @DisplayName("Should skip the references event when no citation survives")
    void shouldOmitEmptyReferences() {
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query(anyString(), any(), eq(10))).thenReturn(List.of());
      when(chatStreamingAgent.chat(anyList())).thenReturn(tokenStream(List.of("Hi"), null));
      when(citationService.extractReferences(anyString(), anyList())).thenReturn(List.of());

      StepVerifier.create(
              chatService.streamChat(persona.getId(), ChatRequest.builder().message("hi").build()))
          .expectNext(ChatStreamEvent.content("Hi"))
          .expectNext(ChatStreamEvent.complete(assistantMessageId, session.getId()))
          .verifyComplete();

      verify(chatSessionService)
          .appendMessage(eq(session), isNull(), eq(MessageRole.ASSISTANT), eq("Hi"), isNull());
    }

    @Test
    @DisplayName("Should end with an error event when generation fails")
    void shouldEmitErrorOnGenerationFailure() {
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query(anyString(), any(), eq(10))).thenReturn(List.of());
      when(chatStreamingAgent.chat(anyList()))
          .thenReturn(tokenStream(List.of("Par"), new RuntimeException("rate limited")));

      StepVerifier.create(
              chatService.streamChat(persona.getId(), ChatRequest.builder().message("q").build()))
          .expectNext(ChatStreamEvent.content("Par"))
          .expectNext(ChatStreamEvent.error(ChatServiceImpl.GENERATION_FAILED))
          .verifyComplete();

      verify(chatSessionService, never())
          .appendMessage(any(), any(), eq(MessageRole.ASSISTANT), anyString(), any());
    }
  }

  @Nested
  @DisplayName("client disconnect")
  class CancellationTests {

    @Test
    @DisplayName("Should drop the answer and skip citations when the client cancels")
    void shouldDiscardAnswerOnCancel() {
      StreamCallbacks callbacks = new StreamCallbacks();
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query(anyString(), any(), eq(10))).thenReturn(List.of());
      when(chatStreamingAgent.chat(anyList())).thenReturn(capturingStream(callbacks));

      Flux<ChatStreamEvent> events =
          chatService.streamChat(persona.getId(), ChatRequest.builder().message("q").build());
      callbacks.onPartial.get().accept("Well ");

      StepVerifier.create(events)
          .expectNext(ChatStreamEvent.content("Well "))
          .thenCancel()
          .verify();

      callbacks.onPartial.get().accept("after disconnect");
      callbacks.onComplete.get().accept(null);

      verify(citationService, never()).extractReferences(anyString(), anyList());
      verify(chatSessionService, never())
          .appendMessage(any(), any(), eq(MessageRole.ASSISTANT), anyString(), any());
      verify(chatSessionService).appendMessage(session, null, MessageRole.USER, "q", null);
      assertThat(meterRegistry.find("chat.tokens.generated").counter()).isNull();
    }
  }

  @Nested
  @DisplayName("retrieval failures")
  class RetrievalFailureTests {

    @Test
    @DisplayName("Should emit a single error event when the question cannot be embedded")
    void shouldEmitErrorWhenEmbeddingFails() {
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[0]);

      StepVerifier.create(
              chatService.streamChat(persona.getId(), ChatRequest.builder().message("q").build()))
          .expectNext(ChatStreamEvent.error(ChatServiceImpl.RETRIEVAL_FAILED))
          .verifyComplete();

      verify(chatStreamingAgent, never()).chat(anyList());
      verify(chatSessionService).appendMessage(session, null, MessageRole.USER, "q", null);
    }

    @Test
    @DisplayName("Should emit a single error event when the vector search fails")
    void shouldEmitErrorWhenSearchFails() {
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query(anyString(), any(), eq(10)))
          .thenThrow(new SearchException("ucbake", "index missing"));

      StepVerifier.create(
              chatService.streamChat(persona.getId(), ChatRequest.builder().message("q").build()))
          .expectNext(ChatStreamEvent.error(ChatServiceImpl.RETRIEVAL_FAILED))
          .verifyComplete();

      assertThat(meterRegistry.counter("chat.errors", "stage", "retrieval").count())
          .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should emit a single error event when the search circuit is open")
    void shouldEmitErrorWhenCircuitOpen() {
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query(anyString(), any(), eq(10)))
          .thenThrow(
              CallNotPermittedException.createCallNotPermittedException(
                  CircuitBreaker.ofDefaults("elasticsearch")));

      StepVerifier.create(
              chatService.streamChat(persona.getId(), ChatRequest.builder().message("q").build()))
          .expectNext(ChatStreamEvent.error(ChatServiceImpl.RETRIEVAL_FAILED))
          .verifyComplete();

      verify(chatStreamingAgent, never()).chat(anyList());
    }

    @Test
    @DisplayName("Should reject an unknown persona before opening a stream")
    void shouldRejectUnknownPersona() {
      UUID unknown = UUID.randomUUID();
      when(personaRepository.findById(unknown)).thenReturn(Optional.empty());

      assertThatThrownBy(
              () -> chatService.streamChat(unknown, ChatRequest.builder().message("q").build()))
          .isInstanceOf(PersonaNotFoundException.class);
    }
  }

  @Nested
  @DisplayName("retrieve")
  class RetrieveTests {

    @Test
    @DisplayName("Should drop matches below the similarity threshold")
    void shouldApplyThreshold() {
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query("ucbake", new float[] {1f}, 3))
          .thenReturn(List.of(match("v1", 10, 0.95), match("v2", 20, 0.4)));
      when(videoRepository.findByPersonaIdAndExternalVideoIdIn(eq(persona.getId()), any()))
          .thenReturn(List.of());

      List<RetrievedExcerpt> excerpts =
          chatService.retrieve(
              persona,
              "q",
              ChatRequest.builder().message("q").topK(3).similarityThreshold(0.9).build());

      assertThat(excerpts).hasSize(1);
      assertThat(excerpts.get(0).videoId()).isEqualTo("v1");
      assertThat(excerpts.get(0).title()).isEqualTo("Untitled video");
    }

    @Test
    @DisplayName("Should prefer the persona's topK over the configured default")
    void shouldUsePersonaTopK() {
      persona.setTopK(4);
      when(embeddingService.embedQuery(anyString())).thenReturn(new float[] {1f});
      when(vectorStore.query(anyString(), any(), eq(4))).thenReturn(List.of());

      assertThat(chatService.retrieve(persona, "q", ChatRequest.builder().message("q").build()))
          .isEmpty();
    }
  }

  @Nested
  @DisplayName("buildSystemPrompt")
  class SystemPromptTests {

    @Test
    @DisplayName("Should label excerpts with title, id and timestamp")
    void shouldFormatExcerpts() {
      String prompt =
          chatService.buildSystemPrompt(
              persona,
              List.of(new RetrievedExcerpt("v1", "Proofing", 3725, "Let it rise", 0.9)));

      assertThat(prompt)
          .contains("You are Bake With Me, an AI persona based on the YouTube channel @bakewithme")
          .contains("Channel description: Bread every week")
          .contains("Video: \"Proofing\" (v1) at 1:02:05")
          .contains("Content: Let it rise");
    }

    @Test
    @DisplayName("Should tell the model when nothing matched")
    void shouldMentionMissingTranscripts() {
      assertThat(chatService.buildSystemPrompt(persona, List.of()))
          .contains("No video transcripts matched this question");
    }

    @Test
    @DisplayName("Should format timestamps under an hour as m:ss")
    void shouldFormatShortTimestamp() {
      assertThat(ChatServiceImpl.formatTimestamp(95.4)).isEqualTo("1:35");
    }
  }
}
