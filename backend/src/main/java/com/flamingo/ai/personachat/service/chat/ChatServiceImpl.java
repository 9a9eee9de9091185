package com.flamingo.ai.personachat.service.chat;

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
import com.flamingo.ai.personachat.exception.LlmServiceException;
import com.flamingo.ai.personachat.exception.PersonaNotFoundException;
import com.flamingo.ai.personachat.service.embedding.EmbeddingService;
import com.flamingo.ai.personachat.vectorstore.VectorMatch;
import com.flamingo.ai.personachat.vectorstore.VectorStore;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/** Implementation of ChatService: retrieve caption excerpts, stream an answer, attach citations. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatServiceImpl implements ChatService {

  static final String RETRIEVAL_FAILED = "Failed to search the persona's videos";
  static final String GENERATION_FAILED = "Failed to generate response";

  private final PersonaRepository personaRepository;
  private final VideoRepository videoRepository;
  private final ChatSessionService chatSessionService;
  private final EmbeddingService embeddingService;
  private final VectorStore vectorStore;
  private final ChatStreamingAgent chatStreamingAgent;
  private final CitationService citationService;
  private final PipelineConfig pipelineConfig;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chat.stream", description = "Time to start a chat stream")
  public Flux<ChatStreamEvent> streamChat(UUID personaId, ChatRequest request) {
    Persona persona =
        personaRepository
            .findById(personaId)
            .orElseThrow(() -> new PersonaNotFoundException(personaId));
    String question = request.getMessage();
    UUID userId = request.getUserId();

    ChatSession session =
        chatSessionService.resolveSession(persona, request.getChatSessionId(), userId, question);
    chatSessionService.appendMessage(session, userId, MessageRole.USER, question, null);
    log.debug("User message saved in chat session {}", session.getId());

    List<RetrievedExcerpt> excerpts;
    try {
      excerpts = retrieve(persona, question, request);
    } catch (RuntimeException e) {
      // open circuit breakers surface here as CallNotPermittedException
      log.error("Retrieval failed for persona {}: {}", personaId, e.getMessage(), e);
      meterRegistry.counter("chat.errors", "stage", "retrieval").increment();
      return Flux.just(ChatStreamEvent.error(RETRIEVAL_FAILED));
    }
    log.info("Retrieved {} excerpts for persona {}", excerpts.size(), persona.getUsername());

    List<dev.langchain4j.data.message.ChatMessage> messages =
        List.of(
            SystemMessage.from(buildSystemPrompt(persona, excerpts)), UserMessage.from(question));

    Sinks.Many<ChatStreamEvent> sink = Sinks.many().unicast().onBackpressureBuffer();
    AtomicBoolean cancelled = new AtomicBoolean(false);
    StringBuilder answer = new StringBuilder();
    AtomicInteger tokenCount = new AtomicInteger(0);

    chatStreamingAgent
        .chat(messages)
        .onPartialResponse(
            token -> {
              if (cancelled.get()) {
                return;
              }
              answer.append(token);
              tokenCount.incrementAndGet();
              var result = sink.tryEmitNext(ChatStreamEvent.content(token));
              if (result.isFailure()) {
                log.warn("Failed to emit token: {}", result);
              }
            })
        .onCompleteResponse(
            response -> {
              if (cancelled.get()) {
                log.info("Chat stream for session {} cancelled, answer discarded", session.getId());
                return;
              }
              finish(sink, session, userId, answer.toString(), excerpts);
              meterRegistry.counter("chat.tokens.generated").increment(tokenCount.get());
            })
        .onError(
            error -> {
              log.error("Error during chat streaming: {}", error.getMessage(), error);
              meterRegistry.counter("chat.errors", "stage", "generation").increment();
              sink.tryEmitNext(ChatStreamEvent.error(GENERATION_FAILED));
              sink.tryEmitComplete();
            })
        .start();

    return sink.asFlux().doOnCancel(() -> cancelled.set(true));
  }

  private void finish(
      Sinks.Many<ChatStreamEvent> sink,
      ChatSession session,
      UUID userId,
      String answer,
      List<RetrievedExcerpt> excerpts) {
    try {
      List<VideoReference> references = citationService.extractReferences(answer, excerpts);
      if (!references.isEmpty()) {
        sink.tryEmitNext(ChatStreamEvent.references(references));
      }
      ChatMessage saved =
          chatSessionService.appendMessage(
              session,
              userId,
              MessageRole.ASSISTANT,
              answer,
              references.isEmpty() ? null : references);
      meterRegistry.counter("chat.messages.generated").increment();
      sink.tryEmitNext(ChatStreamEvent.complete(saved.getId(), session.getId()));
    } catch (RuntimeException e) {
      log.error(
          "Failed to store answer for chat session {}: {}", session.getId(), e.getMessage(), e);
      meterRegistry.counter("chat.errors", "stage", "persistence").increment();
      sink.tryEmitNext(ChatStreamEvent.error(GENERATION_FAILED));
    }
    sink.tryEmitComplete();
  }

  List<RetrievedExcerpt> retrieve(Persona persona, String question, ChatRequest request) {
    PipelineConfig.Retrieval config = pipelineConfig.getRetrieval();
    int topK =
        request.getTopK() != null
            ? request.getTopK()
            : persona.getTopK() != null ? persona.getTopK() : config.getTopK();
    double threshold =
        request.getSimilarityThreshold() != null
            ? request.getSimilarityThreshold()
            : config.getSimilarityThreshold();

    float[] queryVector = embeddingService.embedQuery(question);
    if (queryVector.length == 0) {
      throw new LlmServiceException("Failed to embed question");
    }

    List<VectorMatch> matches = vectorStore.query(persona.getVectorNamespace(), queryVector, topK);
    List<VectorMatch> relevant =
        matches.stream()
            .filter(m -> m.score() >= threshold)
            .filter(m -> m.metadata() != null && m.metadata().videoId() != null)
            .toList();
    log.debug(
        "Vector search returned {} matches, {} above threshold {}",
        matches.size(),
        relevant.size(),
        threshold);
    if (relevant.isEmpty()) {
      return List.of();
    }

    Map<String, String> titles = resolveTitles(persona.getId(), relevant);
    List<RetrievedExcerpt> excerpts = new ArrayList<>();
    for (VectorMatch match : relevant) {
      String videoId = match.metadata().videoId();
      excerpts.add(
          new RetrievedExcerpt(
              videoId,
              titles.getOrDefault(videoId, config.getMissingTitlePlaceholder()),
              match.metadata().startTime(),
              match.metadata().text(),
              match.score()));
    }
    return excerpts;
  }

  private Map<String, String> resolveTitles(UUID personaId, List<VectorMatch> matches) {
    Set<String> videoIds = new LinkedHashSet<>();
    matches.forEach(m -> videoIds.add(m.metadata().videoId()));
    Map<String, String> titles = new HashMap<>();
    for (Video video : videoRepository.findByPersonaIdAndExternalVideoIdIn(personaId, videoIds)) {
      if (video.getTitle() != null && !video.getTitle().isBlank()) {
        titles.put(video.getExternalVideoId(), video.getTitle());
      }
    }
    return titles;
  }

  String buildSystemPrompt(Persona persona, List<RetrievedExcerpt> excerpts) {
    String name = persona.getTitle() != null ? persona.getTitle() : persona.getUsername();
    StringBuilder prompt = new StringBuilder();
    prompt
        .append("You are ")
        .append(name)
        .append(", an AI persona based on the YouTube channel @")
        .append(persona.getUsername())
        .append(".\n\n");
    if (persona.getDescription() != null && !persona.getDescription().isBlank()) {
      prompt.append("Channel description: ").append(persona.getDescription()).append("\n\n");
    }
    prompt.append(
        "You have access to transcripts from your videos. Use them to answer in your authentic "
            + "voice and style. When referencing specific content, mention the video it came "
            + "from.\n\n");

    if (excerpts.isEmpty()) {
      prompt.append(
          "No video transcripts matched this question. Answer from your general perspective and "
              + "say so if you have not covered the topic in your videos.");
    } else {
      prompt.append("Relevant video transcripts for this question:\n");
      for (RetrievedExcerpt excerpt : excerpts) {
        prompt
            .append("Video: \"")
            .append(excerpt.title())
            .append("\" (")
            .append(excerpt.videoId())
            .append(") at ")
            .append(formatTimestamp(excerpt.startTime()))
            .append("\nContent: ")
            .append(excerpt.text())
            .append("\n\n");
      }
      prompt.append("Respond as the channel creator would, using their knowledge and perspective.");
    }
    return prompt.toString();
  }

  static String formatTimestamp(double seconds) {
    long total = Math.max(0, Math.round(seconds));
    long hours = total / 3600;
    long minutes = (total % 3600) / 60;
    long secs = total % 60;
    return hours > 0
        ? String.format("%d:%02d:%02d", hours, minutes, secs)
        : String.format("%d:%02d", minutes, secs);
  }
}
