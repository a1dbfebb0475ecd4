package com.example.autocheckin.service.executor;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import com.example.autocheckin.config.LogbackAppenders;
import com.example.autocheckin.domain.enums.TriggerType;
import com.example.autocheckin.domain.model.AccountContext;
import com.example.autocheckin.domain.model.Task;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Opens one dedicated log file per task execution under {@code <log dir>/tasks}.
 * <p>
 * The file is a Logback appender on the root logger that only accepts events
 * from the executing thread, so everything logged during the execution lands
 * in both the shared log and the task's own file.
 */
@Slf4j
@Component
public class TaskLogFiles {

    static final String MDC_KEY = "taskExecution";
    static final String TASKS_DIR = "tasks";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public TaskLogFiles() {
        this(Clock.systemDefaultZone());
    }

    TaskLogFiles(Clock clock) {
        this.clock = clock;
    }

    /**
     * Create the file and start routing the calling thread's log events into it.
     * Must be closed on the same thread.
     *
     * @throws IOException if the directory or file cannot be created
     */
    public TaskLogFile open(AccountContext account, Task task, TriggerType triggerType) throws IOException {
        var context = LogbackAppenders.context()
                .orElseThrow(() -> new IOException("Logback is not the active logging backend"));

        var dir = Path.of(account.getLog().getEffectiveDir()).resolve(TASKS_DIR);
        Files.createDirectories(dir);
        var file = reserve(dir, fileName(account.getLabel(), task.getDisplayName(), triggerType, LocalDateTime.now(clock)));

        var executionId = Long.toString(sequence.incrementAndGet());
        var appender = LogbackAppenders.startFileAppender(context, "task-" + executionId, file,
                account.getLog().isJson(), new MdcValueFilter(MDC_KEY, executionId));
        var root = context.getLogger(Logger.ROOT_LOGGER_NAME);
        root.addAppender(appender);
        MDC.put(MDC_KEY, executionId);

        log.debug("Opened task log file {}", file);
        return new TaskLogFile(file, appender, root);
    }

    /**
     * {@code <account>_<task>_<trigger>_<yyyyMMdd_HHmmss>.log}, with account and task sanitised
     */
    static String fileName(String accountLabel, String taskName, TriggerType triggerType, LocalDateTime time) {
        return String.format("%s_%s_%s_%s.log",
                sanitize(accountLabel), sanitize(taskName), triggerType.getCode(), TIMESTAMP.format(time));
    }

    /**
     * Replace path separators, reserved characters and spaces with '_', drop '@' and '+'
     */
    static String sanitize(String name) {
        if (name == null) {
            return "";
        }
        var sb = new StringBuilder(name.length());
        for (var c : name.toCharArray()) {
            switch (c) {
                case '/', '\\', ':', '*', '?', '"', '<', '>', '|', ' ' -> sb.append('_');
                case '@', '+' -> {
                }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Two executions of the same task in the same second get distinct files
     */
    private synchronized Path reserve(Path dir, String fileName) throws IOException {
        var base = fileName.substring(0, fileName.length() - ".log".length());
        var candidate = dir.resolve(fileName);
        for (var attempt = 2; ; attempt++) {
            try {
                return Files.createFile(candidate);
            } catch (FileAlreadyExistsException e) {
                candidate = dir.resolve(base + "_" + attempt + ".log");
            }
        }
    }

    /**
     * An open per-execution log file
     */
    @RequiredArgsConstructor
    public static class TaskLogFile implements AutoCloseable {

        @Getter
        private final Path path;
        private final FileAppender<ILoggingEvent> appender;
        private final Logger root;

        @Override
        public void close() {
            MDC.remove(MDC_KEY);
            root.detachAppender(appender);
            appender.stop();
        }
    }
}
