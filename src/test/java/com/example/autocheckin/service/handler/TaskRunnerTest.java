package com.example.autocheckin.service.handler;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.client.MessengerOutcome;
import com.example.autocheckin.domain.enums.ResponseType;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import com.example.autocheckin.domain.model.TaskConfig;
import com.example.autocheckin.exception.MessengerException;
import com.example.autocheckin.exception.TaskExecutionException;
import com.example.autocheckin.exception.UnknownMethodException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskRunner Tests")
class TaskRunnerTest {

    private static final Logger TASK_LOG = LoggerFactory.getLogger(TaskRunnerTest.class);
    private static final ReplyPolicy POLICY = new ReplyPolicy(1, 5);

    @Mock
    private Messenger messenger;

    private TaskRunner taskRunner;

    @BeforeEach
    void setUp() {
        var registry = new TaskHandlerRegistry(List.of(new MessageTaskHandler(), new ButtonTaskHandler()));
        registry.initialize();
        taskRunner = new TaskRunner(registry);
    }

    private static Task task(String method, String target, String payload) {
        return Task.from(TaskConfig.builder()
                .name("checkin")
                .target(target)
                .method(method)
                .payload(payload)
                .build());
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        @Test
        @DisplayName("Should send text for message tasks")
        void shouldSendText() {
            // Given
            when(messenger.sendText(eq("@bot"), eq("/checkin"), eq(POLICY), any(Logger.class)))
                    .thenReturn(MessengerOutcome.builder().replyText("done").build());

            // When
            var outcome = taskRunner.run(task("message", "@bot", "/checkin"), messenger, POLICY, TASK_LOG);

            // Then
            assertThat(outcome.getResponseType()).isEqualTo(ResponseType.REPLY);
            assertThat(outcome.getReplyText()).isEqualTo("done");
            verify(messenger, never()).clickButton(anyString(), anyString(), any(), any(Logger.class));
        }

        @Test
        @DisplayName("Should click the button for button tasks, method matched case-insensitively")
        void shouldClickButton() {
            when(messenger.clickButton(eq("@bot"), eq("Claim"), eq(POLICY), any(Logger.class)))
                    .thenReturn(MessengerOutcome.builder().url("https://example.org").build());

            var outcome = taskRunner.run(task(" Button ", "@bot", "Claim"), messenger, POLICY, TASK_LOG);

            assertThat(outcome.getResponseType()).isEqualTo(ResponseType.URL);
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("Should fail with UnknownMethodException without touching the messenger")
        void shouldRejectUnknownMethod() {
            assertThatThrownBy(() -> taskRunner.run(task("sms", "@bot", "hi"), messenger, POLICY, TASK_LOG))
                    .isInstanceOf(UnknownMethodException.class)
                    .hasMessage("unknown method \"sms\"");

            verifyNoInteractions(messenger);
        }

        @Test
        @DisplayName("Should wrap validation failures in TaskExecutionException")
        void shouldWrapValidationFailure() {
            assertThatThrownBy(() -> taskRunner.run(task("button", "@bot", ""), messenger, POLICY, TASK_LOG))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasMessageContaining("Button text");

            verifyNoInteractions(messenger);
        }

        @Test
        @DisplayName("Should wrap messenger failures in TaskExecutionException")
        void shouldWrapMessengerFailure() {
            when(messenger.sendText(anyString(), anyString(), any(), any(Logger.class)))
                    .thenThrow(new MessengerException("send-message", "peer not found"));

            assertThatThrownBy(() -> taskRunner.run(task("message", "@bot", "/checkin"), messenger, POLICY, TASK_LOG))
                    .isInstanceOf(TaskExecutionException.class)
                    .hasCauseInstanceOf(MessengerException.class)
                    .hasMessageContaining("checkin");
        }
    }
}
