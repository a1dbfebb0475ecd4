package com.example.autocheckin.service.executor;

import com.example.autocheckin.client.Messenger;
import com.example.autocheckin.config.CheckinProperties;
import com.example.autocheckin.config.MetricsConfig;
import com.example.autocheckin.domain.model.AccountContext;
import com.example.autocheckin.service.handler.TaskRunner;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds one executor per account session, sized from the account config.
 */
@Component
@RequiredArgsConstructor
public class TaskExecutorFactory {

    private final TaskRunner taskRunner;
    private final TaskLogFiles taskLogFiles;
    private final MetricsConfig metricsConfig;
    private final CheckinProperties properties;

    public AccountTaskExecutor create(AccountContext account, Messenger messenger) {
        var config = account.getAccount();
        return new AccountTaskExecutor(account, messenger, taskRunner, taskLogFiles, metricsConfig,
                config.getWorkerCount(), config.getTaskQueueSize(), properties.getWorkerPollIntervalMs());
    }
}
