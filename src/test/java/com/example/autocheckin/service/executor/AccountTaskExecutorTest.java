package com.example.autocheckin.service.executor;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.config.MetricsConfig;
import com.example.autocheckin.domain.enums.ExecutorState;
import com.example.autocheckin.domain.enums.TriggerType;
import com.example.autocheckin.domain.model.AccountConfig;
import com.example.autocheckin.domain.model.AccountContext;
import com.example.autocheckin.domain.model.AppConfig;
import com.example.autocheckin.domain.model.LogConfig;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import com.example.autocheckin.domain.model.TaskConfig;
import com.example.autocheckin.exception.UnknownMethodException;
import com.example.autocheckin.service.CancellationToken;
import com.example.autocheckin.service.config.ConfigResolver;
import com.example.autocheckin.service.handler.TaskOutcome;
import com.example.autocheckin.service.handler.TaskRunner;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AccountTaskExecutor Tests")
class AccountTaskExecutorTest {

    private static final long POLL_INTERVAL_MS = 20;

    @TempDir
    Path logDir;

    @Mock
    private TaskRunner taskRunner;

    @Mock
    private Messenger messenger;

    private SimpleMeterRegistry meterRegistry;
    private MetricsConfig metricsConfig;
    private AccountContext account;
    private ListAppender<ILoggingEvent> logAppender;
    private Logger executorLogger;
    private AccountTaskExecutor executor;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metricsConfig = new MetricsConfig(meterRegistry);

        var global = AppConfig.builder()
                .log(LogConfig.builder().dir(logDir.toString()).build())
                .build();
        var accountConfig = AccountConfig.builder().name("main").phone("+15550100").build();
        account = AccountContext.of(global, accountConfig, new ConfigResolver());

        executorLogger = (Logger) LoggerFactory.getLogger(AccountTaskExecutor.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        executorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.stopNow();
        }
        executorLogger.detachAppender(logAppender);
    }

    private AccountTaskExecutor newExecutor(int workers, int capacity) {
        executor = new AccountTaskExecutor(account, messenger, taskRunner, new TaskLogFiles(), metricsConfig,
                workers, capacity, POLL_INTERVAL_MS);
        return executor;
    }

    private static Task task(String name, String method) {
        return Task.from(TaskConfig.builder()
                .name(name)
                .target("@bot")
                .method(method)
                .payload("/checkin")
                .build());
    }

    private boolean logged(Level level, String fragment) {
        return logAppender.list.stream()
                .anyMatch(e -> e.getLevel() == level && e.getFormattedMessage().contains(fragment));
    }

    @Nested
    @DisplayName("Sizing")
    class SizingTests {

        @Test
        @DisplayName("Should fall back to 4 workers and 100 queue slots for non-positive values")
        void shouldApplyDefaults() {
            var created = newExecutor(0, -1);

            assertThat(created.getWorkerCount()).isEqualTo(4);
            assertThat(created.getQueueCapacity()).isEqualTo(100);
            assertThat(created.state()).isEqualTo(ExecutorState.CREATED);
        }
    }

    @Nested
    @DisplayName("Submission")
    class SubmissionTests {

        @Test
        @DisplayName("Should drop the submission beyond capacity and log a warning")
        void shouldDropWhenFull() {
            // Given
            newExecutor(1, 2);

            // When
            var first = executor.submitTask(task("a", "message"), TriggerType.SCHEDULED);
            var second = executor.submitTask(task("b", "message"), TriggerType.SCHEDULED);
            var third = executor.submitTask(task("c", "message"), TriggerType.SCHEDULED);

            // Then
            assertThat(first).isTrue();
            assertThat(second).isTrue();
            assertThat(third).isFalse();
            assertThat(executor.queueLength()).isEqualTo(2);
            assertThat(logged(Level.WARN, "Task queue is full, dropping task c")).isTrue();
            assertThat(meterRegistry.counter("checkin_tasks_dropped", "account", "main(+15550100)").count())
                    .isEqualTo(1.0);
            verifyNoInteractions(taskRunner);
        }

        @Test
        @DisplayName("Should wait for space with blocking submission")
        void shouldWaitForSpace() throws Exception {
            // Given: one worker held busy, one queued request filling the queue
            newExecutor(1, 1);
            var started = new CountDownLatch(1);
            var release = new CountDownLatch(1);
            when(taskRunner.run(any(), any(), any(), any())).thenAnswer(invocation -> {
                started.countDown();
                release.await(5, TimeUnit.SECONDS);
                return TaskOutcome.noReply();
            });
            var token = new CancellationToken();
            executor.start(token);
            executor.submitTask(task("a", "message"), TriggerType.ONCE);
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(executor.submitTask(task("b", "message"), TriggerType.ONCE)).isTrue();

            // When
            var blocked = CompletableFuture.supplyAsync(
                    () -> executor.submitTaskBlocking(token, task("c", "message"), TriggerType.ONCE));
            Thread.sleep(150);
            assertThat(blocked).isNotDone();
            release.countDown();

            // Then
            assertThat(blocked.get(5, TimeUnit.SECONDS)).isTrue();
            executor.stop();
            verify(taskRunner, times(3)).run(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should give up blocking submission once the token is cancelled")
        void shouldGiveUpWhenCancelled() throws Exception {
            newExecutor(1, 1);
            executor.submitTask(task("a", "message"), TriggerType.ONCE);
            var token = new CancellationToken();

            var blocked = CompletableFuture.supplyAsync(
                    () -> executor.submitTaskBlocking(token, task("b", "message"), TriggerType.ONCE));
            Thread.sleep(100);
            token.cancel();

            assertThat(blocked.get(5, TimeUnit.SECONDS)).isFalse();
        }

        @Test
        @DisplayName("Should reject submissions after stop")
        void shouldRejectAfterStop() {
            newExecutor(1, 5);
            executor.start(new CancellationToken());
            executor.stop();

            assertThat(executor.submitTask(task("a", "message"), TriggerType.SCHEDULED)).isFalse();
            assertThat(executor.state()).isEqualTo(ExecutorState.STOPPED);
        }
    }

    @Nested
    @DisplayName("Execution")
    class ExecutionTests {

        @Test
        @DisplayName("Should run queued tasks on stop and log a completed-without-reply event")
        void shouldDrainOnStop() {
            // Given
            newExecutor(2, 10);
            when(taskRunner.run(any(), eq(messenger), any(ReplyPolicy.class), any())).thenReturn(TaskOutcome.noReply());
            executor.submitTask(task("a", "message"), TriggerType.RUN_ON_START);
            executor.submitTask(task("b", "message"), TriggerType.RUN_ON_START);

            // When
            executor.start(new CancellationToken());
            executor.stop();

            // Then
            verify(taskRunner, times(2)).run(any(), eq(messenger), any(ReplyPolicy.class), any());
            assertThat(logged(Level.INFO, "Executing startup task...")).isTrue();
            assertThat(logged(Level.INFO, "Task completed, no reply")).isTrue();
            assertThat(executor.queueLength()).isZero();
        }

        @Test
        @DisplayName("Should run every submission that was accepted while stop was in progress")
        void shouldRunEveryAcceptedSubmissionRacingStop() throws Exception {
            // Given
            newExecutor(2, 1000);
            when(taskRunner.run(any(), eq(messenger), any(ReplyPolicy.class), any())).thenReturn(TaskOutcome.noReply());
            executor.start(new CancellationToken());
            var accepted = new AtomicInteger();
            var firstAccepted = new CountDownLatch(1);
            var submitter = CompletableFuture.runAsync(() -> {
                for (var i = 0; i < 500; i++) {
                    if (!executor.submitTask(task("t" + i, "message"), TriggerType.SCHEDULED)) {
                        break;
                    }
                    accepted.incrementAndGet();
                    firstAccepted.countDown();
                }
            });

            // When
            assertThat(firstAccepted.await(5, TimeUnit.SECONDS)).isTrue();
            executor.stop();
            submitter.get(5, TimeUnit.SECONDS);

            // Then
            verify(taskRunner, times(accepted.get())).run(any(), eq(messenger), any(ReplyPolicy.class), any());
            assertThat(logged(Level.WARN, "Discarded")).isFalse();
            assertThat(executor.queueLength()).isZero();
        }

        @Test
        @DisplayName("Should keep the worker alive after an unknown method failure")
        void shouldContinueAfterUnknownMethod() {
            // Given
            newExecutor(1, 10);
            var bad = task("bad", "sms");
            var good = task("good", "message");
            when(taskRunner.run(eq(bad), any(), any(), any())).thenThrow(new UnknownMethodException("sms"));
            when(taskRunner.run(eq(good), any(), any(), any())).thenReturn(TaskOutcome.noReply());
            executor.submitTask(bad, TriggerType.SCHEDULED);
            executor.submitTask(good, TriggerType.SCHEDULED);

            // When
            executor.start(new CancellationToken());
            executor.stop();

            // Then
            verify(taskRunner).run(eq(good), any(), any(), any());
            assertThat(logged(Level.ERROR, "Scheduled task failed: unknown method \"sms\"")).isTrue();
            assertThat(meterRegistry.counter("checkin_task_failures",
                    "account", "main(+15550100)", "error_type", "UnknownMethodException").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should discard queued work when the external token is cancelled")
        void shouldDiscardAfterCancellation() {
            newExecutor(1, 10);
            executor.submitTask(task("a", "message"), TriggerType.SCHEDULED);
            var token = new CancellationToken();
            token.cancel();

            executor.start(token);
            executor.stop();

            verifyNoInteractions(taskRunner);
            assertThat(logged(Level.WARN, "Discarded 1 queued task(s)")).isTrue();
        }

        @Test
        @DisplayName("Should write each execution to its own log file")
        void shouldWriteTaskLogFile() throws IOException {
            newExecutor(1, 10);
            when(taskRunner.run(any(), any(), any(), any())).thenReturn(TaskOutcome.noReply());
            executor.submitTask(task("daily checkin", "message"), TriggerType.RUN_ON_START);

            executor.start(new CancellationToken());
            executor.stop();

            Path file;
            try (Stream<Path> files = Files.list(logDir.resolve("tasks"))) {
                file = files.findFirst().orElseThrow();
            }
            assertThat(file.getFileName().toString()).startsWith("main(15550100)_daily_checkin_run_on_start_");
            assertThat(Files.readString(file))
                    .contains("Executing startup task...")
                    .contains("Task completed, no reply");
        }
    }
}
