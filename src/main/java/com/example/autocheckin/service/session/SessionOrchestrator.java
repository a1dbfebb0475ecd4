package com.example.autocheckin.service.session;

import com.example.autocheckin.client.MessengerFactory;
import com.example.autocheckin.config.CheckinProperties;
import com.example.autocheckin.domain.enums.TriggerType;
import com.example.autocheckin.domain.model.AccountConfig;
import com.example.autocheckin.domain.model.AccountContext;
import com.example.autocheckin.domain.model.AccountPlan;
import com.example.autocheckin.domain.model.AppConfig;
import com.example.autocheckin.domain.model.AppCredentials;
import com.example.autocheckin.domain.model.Task;
import com.example.autocheckin.exception.AuthException;
import com.example.autocheckin.exception.ConfigException;
import com.example.autocheckin.exception.MessengerException;
import com.example.autocheckin.exception.RunOnceException;
import com.example.autocheckin.exception.ScheduleException;
import com.example.autocheckin.exception.TaskExecutionException;
import com.example.autocheckin.service.CancellationToken;
import com.example.autocheckin.service.config.ConfigResolver;
import com.example.autocheckin.service.executor.AccountTaskExecutor;
import com.example.autocheckin.service.executor.TaskExecutorFactory;
import com.example.autocheckin.service.scheduler.CheckinScheduler;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the lifecycle of every account session.
 * <p>
 * Per account: resolve credentials, open one messenger session, authenticate,
 * start one executor, submit startup tasks, register schedules, then wait for
 * cancellation. A failure in one account never aborts the others.
 * <p>
 * Two modes:
 * - run-once: accounts are processed one after another, every enabled task is
 * submitted with blocking submission, failures are collected and reported together
 * - run-forever: one thread per account, all sharing a single scheduler,
 * until the process-wide token is cancelled
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionOrchestrator {

    private final ConfigResolver configResolver;
    private final AccountPlanner accountPlanner;
    private final MessengerFactory messengerFactory;
    private final TaskExecutorFactory executorFactory;
    private final CheckinScheduler scheduler;
    private final CheckinProperties properties;

    /**
     * Process-wide cancellation signal, cancelled when the application context closes
     */
    @Getter
    private final CancellationToken processToken = new CancellationToken();

    private final List<Thread> sessionThreads = new CopyOnWriteArrayList<>();

    /**
     * Attempt every enabled task of every account once, then return.
     * Cancellation ends the pass early without an error.
     *
     * @throws RunOnceException if any account failed or any task could not be submitted
     */
    public void runOnce(AppConfig config, CancellationToken token) {
        var errors = new ArrayList<Exception>();

        for (var account : config.getAccounts()) {
            if (token.isCancelled()) {
                log.info("Run cancelled, remaining accounts skipped");
                return;
            }
            withAccountMdc(account, () -> runAccountOnce(config, account, token, errors));
        }

        if (token.isCancelled()) {
            log.info("Run cancelled");
            return;
        }
        if (!errors.isEmpty()) {
            throw new RunOnceException(errors);
        }
    }

    /**
     * Start one session thread per account with runnable tasks and, if any
     * account has scheduled tasks, the shared scheduler. Returns immediately.
     */
    public void runForever(AppConfig config, CancellationToken token) {
        var anyScheduled = false;

        for (var account : config.getAccounts()) {
            var plan = accountPlanner.plan(account);
            if (!plan.hasRunnableTasks()) {
                log.info("No runnable tasks configured, skipping account {}", account.getLabel());
                continue;
            }

            AppCredentials credentials;
            try {
                credentials = configResolver.resolveAppCredentials(config, account);
            } catch (ConfigException e) {
                log.error("Account {} configuration incomplete: {}", account.getLabel(), e.getMessage());
                continue;
            }

            if (!plan.getScheduledTasks().isEmpty()) {
                anyScheduled = true;
            }

            var context = AccountContext.of(config, account, configResolver);
            var thread = new Thread(
                    () -> withAccountMdc(account, () -> runSession(context, plan, credentials, token)),
                    "checkin-session-" + account.getSessionName());
            sessionThreads.add(thread);
            thread.start();
        }

        if (!anyScheduled) {
            log.info("No scheduled tasks, scheduler not started");
            return;
        }
        token.onCancel(scheduler::stop);
        scheduler.start();
    }

    /**
     * Cancel everything and wait for account sessions to wind down
     */
    @PreDestroy
    public void shutdown() {
        if (!sessionThreads.isEmpty()) {
            log.info("Received exit signal, shutting down...");
        }
        processToken.cancel();
        scheduler.stop();

        var deadline = Instant.now().plusSeconds(properties.getShutdownGraceSeconds());
        for (var thread : sessionThreads) {
            try {
                var remaining = Duration.between(Instant.now(), deadline);
                if (!remaining.isNegative()) {
                    thread.join(Math.max(1, remaining.toMillis()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (thread.isAlive()) {
                log.warn("Session thread {} did not finish within {}s", thread.getName(), properties.getShutdownGraceSeconds());
            }
        }
        sessionThreads.clear();
    }

    private void runAccountOnce(AppConfig config, AccountConfig account, CancellationToken token, List<Exception> errors) {
        var plan = accountPlanner.plan(account);
        if (!plan.hasEnabledTasks()) {
            log.info("No enabled tasks, skipping account {}", account.getLabel());
            return;
        }
        var enabledCount = plan.getEnabledTasks().size();
        log.info("Starting {} task(s) for {}", enabledCount, account.getLabel());

        try {
            var credentials = configResolver.resolveAppCredentials(config, account);
            var context = AccountContext.of(config, account, configResolver);

            try (var session = messengerFactory.open(account.getSessionName(), credentials, config.getProxy())) {
                session.authenticate(account.getPhone(), account.getPassword());

                var executor = executorFactory.create(context, session);
                executor.start(token);
                var failed = new ArrayList<Exception>();
                try {
                    for (var task : plan.getEnabledTasks()) {
                        if (!executor.submitTaskBlocking(token, task, TriggerType.ONCE)) {
                            failed.add(new TaskExecutionException(task.getDisplayName(), "failed to submit task"));
                        }
                    }
                } finally {
                    executor.stop();
                }

                if (failed.isEmpty()) {
                    log.info("All tasks completed for {} ({} total)", account.getLabel(), enabledCount);
                } else {
                    log.warn("Some tasks failed for {}: {} of {}", account.getLabel(), failed.size(), enabledCount);
                    errors.addAll(failed);
                }
            }
        } catch (ConfigException | AuthException | MessengerException e) {
            log.error("Account {} failed: {}", account.getLabel(), e.getMessage());
            errors.add(e);
        } catch (RuntimeException e) {
            log.error("Account {} failed unexpectedly: {}", account.getLabel(), e.getMessage(), e);
            errors.add(e);
        }
    }

    private void runSession(AccountContext context, AccountPlan plan, AppCredentials credentials, CancellationToken token) {
        var account = context.getAccount();
        try (var session = messengerFactory.open(context.getSessionName(), credentials, context.getGlobal().getProxy())) {
            session.authenticate(account.getPhone(), account.getPassword());

            var executor = executorFactory.create(context, session);
            executor.start(token);
            try {
                plan.getStartupTasks().forEach(task -> executor.submitTask(task, TriggerType.RUN_ON_START));
                registerSchedules(context, plan, executor, token);
                token.await();
            } finally {
                executor.stop();
            }
        } catch (ConfigException | AuthException | MessengerException e) {
            log.error("Account {} session ended: {}", context.getLabel(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.error("Account {} session failed unexpectedly: {}", context.getLabel(), e.getMessage(), e);
        }
        log.info("Account {} session closed", context.getLabel());
    }

    /**
     * A bad expression skips that one entry; the rest are still registered
     *
     * @return number of registered entries
     */
    int registerSchedules(AccountContext context, AccountPlan plan, AccountTaskExecutor executor, CancellationToken token) {
        var registered = 0;
        for (var task : plan.getScheduledTasks()) {
            try {
                scheduler.addTask(task.getSchedule(), () -> submitScheduled(executor, task, token));
                registered++;
                log.debug("Scheduled task {} added with '{}' (target: {})",
                        task.getDisplayName(), task.getSchedule(), task.getTarget());
            } catch (ScheduleException e) {
                log.error("Failed to add scheduled task {} for {}: {}",
                        task.getDisplayName(), context.getLabel(), e.getMessage());
            }
        }
        return registered;
    }

    private void submitScheduled(AccountTaskExecutor executor, Task task, CancellationToken token) {
        if (token.isCancelled()) {
            return;
        }
        executor.submitTask(task, TriggerType.SCHEDULED);
    }

    private void withAccountMdc(AccountConfig account, Runnable body) {
        MDC.put("account", account.getLabel());
        MDC.put("session", account.getSessionName());
        try {
            body.run();
        } finally {
            MDC.remove("account");
            MDC.remove("session");
        }
    }
}
