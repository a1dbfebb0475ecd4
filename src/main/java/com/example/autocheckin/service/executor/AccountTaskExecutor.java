package com.example.autocheckin.service.executor;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.config.MetricsConfig;
import com.example.autocheckin.domain.enums.ExecutorState;
import com.example.autocheckin.domain.enums.TriggerType;
import com.example.autocheckin.domain.model.AccountConfig;
import com.example.autocheckin.domain.model.AccountContext;
import com.example.autocheckin.domain.model.Task;
import com.example.autocheckin.domain.model.TaskRequest;
import com.example.autocheckin.exception.AuthException;
import com.example.autocheckin.exception.TaskExecutionException;
import com.example.autocheckin.exception.UnknownMethodException;
import com.example.autocheckin.service.CancellationToken;
import com.example.autocheckin.service.handler.TaskOutcome;
import com.example.autocheckin.service.handler.TaskRunner;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Bounded worker pool serving one account.
 * <p>
 * Handles:
 * - Non-blocking submission that drops when the queue is full
 * - Blocking submission that waits for space until cancelled
 * - Per-execution log files and outcome logging
 * - Draining the queue on stop
 * <p>
 * A failing task never stops its worker; the failure is logged and the worker
 * takes the next request.
 */
@Slf4j
public class AccountTaskExecutor {

    private final AccountContext account;
    private final Messenger messenger;
    private final TaskRunner taskRunner;
    private final TaskLogFiles taskLogFiles;
    private final MetricsConfig metricsConfig;
    private final int workerCount;
    private final int queueCapacity;
    private final long pollIntervalMs;

    private final BlockingQueue<TaskRequest> queue;
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicReference<ExecutorState> state = new AtomicReference<>(ExecutorState.CREATED);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    // submitters hold the read lock from the acceptance check through the offer; closing takes the write lock
    private final ReadWriteLock submitLock = new ReentrantReadWriteLock();

    private volatile CancellationToken externalCancellation = new CancellationToken();
    private ExecutorService workers;

    public AccountTaskExecutor(AccountContext account, Messenger messenger, TaskRunner taskRunner,
                               TaskLogFiles taskLogFiles, MetricsConfig metricsConfig,
                               int workerCount, int queueCapacity, long pollIntervalMs) {
        this.account = account;
        this.messenger = messenger;
        this.taskRunner = taskRunner;
        this.taskLogFiles = taskLogFiles;
        this.metricsConfig = metricsConfig;
        this.workerCount = workerCount > 0 ? workerCount : AccountConfig.DEFAULT_WORKER_COUNT;
        this.queueCapacity = queueCapacity > 0 ? queueCapacity : AccountConfig.DEFAULT_TASK_QUEUE_SIZE;
        this.pollIntervalMs = pollIntervalMs;
        this.queue = new ArrayBlockingQueue<>(this.queueCapacity);
    }

    /**
     * Launch the workers. They exit when the external token or this executor is
     * cancelled, or when the queue is closed and drained.
     *
     * @throws IllegalStateException if the executor was already started or stopped
     */
    public void start(CancellationToken external) {
        if (!state.compareAndSet(ExecutorState.CREATED, ExecutorState.RUNNING)) {
            throw new IllegalStateException("Executor for " + account.getLabel() + " is " + state.get());
        }
        externalCancellation = external;

        var threadFactory = new CustomizableThreadFactory("checkin-" + TaskLogFiles.sanitize(account.getLabel()) + "-worker-");
        threadFactory.setDaemon(true);
        workers = Executors.newFixedThreadPool(workerCount, threadFactory);
        for (var i = 1; i <= workerCount; i++) {
            var workerId = i;
            workers.execute(() -> workerLoop(workerId));
        }
        workers.shutdown();

        metricsConfig.registerQueueDepth(account.getLabel(), queue::size);
        log.info("Task executor started for {}: {} workers, queue capacity {}",
                account.getLabel(), workerCount, queueCapacity);
    }

    /**
     * Enqueue without waiting.
     *
     * @return false if the queue is full or the executor is stopping
     */
    public boolean submitTask(Task task, TriggerType triggerType) {
        boolean enqueued;
        submitLock.readLock().lock();
        try {
            if (!isAccepting()) {
                log.warn("Executor for {} is stopping, rejecting task {}", account.getLabel(), task.getDisplayName());
                return false;
            }
            enqueued = queue.offer(newRequest(task, triggerType));
        } finally {
            submitLock.readLock().unlock();
        }
        if (enqueued) {
            metricsConfig.recordSubmission(account.getLabel(), triggerType);
            log.debug("Queued task {} ({}) for {}", task.getDisplayName(), triggerType.getCode(), account.getLabel());
            return true;
        }
        log.warn("Task queue is full, dropping task {} (account: {}, capacity: {})",
                task.getDisplayName(), account.getLabel(), queueCapacity);
        metricsConfig.recordDropped(account.getLabel());
        return false;
    }

    /**
     * Enqueue, waiting for space as long as the token is not cancelled.
     *
     * @return true once enqueued, false if cancelled or stopped first
     */
    public boolean submitTaskBlocking(CancellationToken token, Task task, TriggerType triggerType) {
        var request = newRequest(task, triggerType);
        while (!token.isCancelled()) {
            boolean enqueued;
            submitLock.readLock().lock();
            try {
                if (!isAccepting()) {
                    log.warn("Executor for {} is stopping, rejecting task {}", account.getLabel(), task.getDisplayName());
                    return false;
                }
                enqueued = queue.offer(request, pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } finally {
                submitLock.readLock().unlock();
            }
            if (enqueued) {
                metricsConfig.recordSubmission(account.getLabel(), triggerType);
                return true;
            }
        }
        log.warn("Cancelled while waiting for queue space, task {} not submitted", task.getDisplayName());
        return false;
    }

    /**
     * Close the queue and wait for the workers to drain it and exit.
     * Requests left behind after a cancellation are discarded. Idempotent.
     */
    public void stop() {
        var previous = state.getAndUpdate(s -> s == ExecutorState.STOPPED ? s : ExecutorState.STOPPING);
        if (previous == ExecutorState.STOPPED || previous == ExecutorState.STOPPING) {
            return;
        }
        submitLock.writeLock().lock();
        try {
            closed.set(true);
        } finally {
            submitLock.writeLock().unlock();
        }
        log.debug("Stopping task executor for {}", account.getLabel());

        if (workers != null) {
            awaitWorkers();
        }

        var leftovers = new ArrayList<TaskRequest>();
        queue.drainTo(leftovers);
        if (!leftovers.isEmpty()) {
            log.warn("Discarded {} queued task(s) for {} on shutdown", leftovers.size(), account.getLabel());
        }

        state.set(ExecutorState.STOPPED);
        log.info("Task executor stopped for {}", account.getLabel());
    }

    /**
     * Cancel the workers after their current execution, then stop
     */
    public void stopNow() {
        cancellation.cancel();
        stop();
    }

    public int queueLength() {
        return queue.size();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public ExecutorState state() {
        return state.get();
    }

    private boolean isAccepting() {
        return !closed.get() && state.get().isAcceptingTasks();
    }

    private TaskRequest newRequest(Task task, TriggerType triggerType) {
        return TaskRequest.builder()
                .task(task)
                .triggerType(triggerType)
                .account(account)
                .build();
    }

    private void awaitWorkers() {
        try {
            while (!workers.awaitTermination(1, TimeUnit.MINUTES)) {
                log.info("Waiting for {} workers to finish", account.getLabel());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private boolean isCancelled() {
        return cancellation.isCancelled() || externalCancellation.isCancelled();
    }

    private void workerLoop(int workerId) {
        log.debug("Worker {} started for {}", workerId, account.getLabel());
        while (!isCancelled()) {
            TaskRequest request;
            try {
                request = queue.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (request == null) {
                if (closed.get() && queue.isEmpty()) {
                    break;
                }
                continue;
            }
            execute(request.withWorkerId(workerId));
        }
        log.debug("Worker {} exiting for {}", workerId, account.getLabel());
    }

    /**
     * Run one request; never throws
     */
    void execute(TaskRequest request) {
        var task = request.getTask();
        var triggerType = request.getTriggerType();

        MDC.put("account", account.getLabel());
        MDC.put("task", task.getDisplayName());
        MDC.put("trigger", triggerType.getCode());
        MDC.put("session", account.getSessionName());
        MDC.put("workerId", String.valueOf(request.getWorkerId()));

        TaskLogFiles.TaskLogFile logFile = null;
        try {
            logFile = taskLogFiles.open(account, task, triggerType);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to create task log file, logging to main log only: {}", e.getMessage());
        }

        try {
            runAndLog(task, triggerType);
        } finally {
            if (logFile != null) {
                logFile.close();
            }
            MDC.remove("account");
            MDC.remove("task");
            MDC.remove("trigger");
            MDC.remove("session");
            MDC.remove("workerId");
        }
    }

    private void runAndLog(Task task, TriggerType triggerType) {
        log.info("{} (target: {}, method: {}, payload: {})",
                triggerType.getStartMessage(), task.getTarget(), task.getMethodCode(), task.getPayload());

        var timerSample = metricsConfig.startTaskExecutionTimer();
        try {
            var outcome = taskRunner.run(task, messenger, account.replyPolicyFor(task), log);
            logOutcome(outcome);
            metricsConfig.recordTaskExecution(timerSample, account.getLabel(), task.getMethodCode(), true);
        } catch (UnknownMethodException | TaskExecutionException | AuthException e) {
            log.error("{}: {} (payload: {})", triggerType.getFailureMessage(), e.getMessage(), task.getPayload());
            recordFailure(timerSample, task, e);
        } catch (Exception e) {
            log.error("{}: {} (payload: {})", triggerType.getFailureMessage(), e.getMessage(), task.getPayload(), e);
            recordFailure(timerSample, task, e);
        }
    }

    private void recordFailure(Timer.Sample timerSample, Task task, Exception e) {
        metricsConfig.recordTaskExecution(timerSample, account.getLabel(), task.getMethodCode(), false);
        metricsConfig.recordTaskFailure(account.getLabel(), e.getClass().getSimpleName());
    }

    private void logOutcome(TaskOutcome outcome) {
        switch (outcome.getResponseType()) {
            case REPLY -> log.info("Task completed successfully, received reply: {}", outcome.getReplyText());
            case URL -> log.info("Task completed successfully, received URL: {}", outcome.getUrl());
            default -> log.info("Task completed, no reply");
        }
    }
}
