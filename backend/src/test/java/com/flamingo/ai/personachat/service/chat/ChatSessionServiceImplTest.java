package com.flamingo.ai.personachat.service.chat;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.personachat.domain.entity.ChatSession;
import com.flamingo.ai.personachat.domain.entity.Persona;
import com.flamingo.ai.personachat.domain.repository.ChatMessageRepository;
import com.flamingo.ai.personachat.domain.repository.ChatSessionRepository;
import com.flamingo.ai.personachat.exception.ChatSessionNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ChatSessionServiceImplTest {

  @Mock private ChatSessionRepository chatSessionRepository;
  @Mock private ChatMessageRepository chatMessageRepository;

  private ChatSessionServiceImpl chatSessionService;
  private Persona persona;

  @BeforeEach
  void setUp() {
    chatSessionService =
        new ChatSessionServiceImpl(
            chatSessionRepository, chatMessageRepository, new SimpleMeterRegistry());
    persona = Persona.builder().id(UUID.randomUUID()).username("bakewithme").build();
  }

  @Nested
  @DisplayName("resolveSession")
  class ResolveSessionTests {

    @Test
    @DisplayName("Should create a session titled after the first message")
    void shouldCreateSession() {
      when(chatSessionRepository.save(any(ChatSession.class)))
          .thenAnswer(invocation -> invocation.getArgument(0));

      ChatSession session =
          chatSessionService.resolveSession(persona, null, null, "  Why   rye flour?  ");

      assertThat(session.getTitle()).isEqualTo("Why rye flour?");
      assertThat(session.getPersona()).isSameAs(persona);
    }

    @Test
    @DisplayName("Should reuse an existing session of the same persona")
    void shouldReuseSession() {
      ChatSession existing = ChatSession.builder().id(UUID.randomUUID()).persona(persona).build();
      when(chatSessionRepository.findById(existing.getId())).thenReturn(Optional.of(existing));

      assertThat(chatSessionService.resolveSession(persona, existing.getId(), null, "again"))
          .isSameAs(existing);
      verify(chatSessionRepository, never()).save(any());
    }

    @Test
    @DisplayName("Should refuse a session of another persona")
    void shouldRefuseForeignSession() {
      Persona other = Persona.builder().id(UUID.randomUUID()).build();
      ChatSession foreign = ChatSession.builder().id(UUID.randomUUID()).persona(other).build();
      when(chatSessionRepository.findById(foreign.getId())).thenReturn(Optional.of(foreign));

      assertThatThrownBy(
              () -> chatSessionService.resolveSession(persona, foreign.getId(), null, "hi"))
          .isInstanceOf(ChatSessionNotFoundException.class);
    }
  }

  @Test
  @DisplayName("Should shorten long titles and default empty ones")
  void shouldDeriveTitles() {
    String title = ChatSessionServiceImpl.deriveTitle("x".repeat(80));

    assertThat(title).hasSize(60).endsWith("...");
    assertThat(ChatSessionServiceImpl.deriveTitle("   ")).isEqualTo("New chat");
  }

  @Test
  @DisplayName("Should throw when listing messages of an unknown session")
  void shouldThrowForUnknownSession() {
    UUID unknown = UUID.randomUUID();
    when(chatSessionRepository.findById(unknown)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> chatSessionService.getMessages(unknown))
        .isInstanceOf(ChatSessionNotFoundException.class);
  }
}
