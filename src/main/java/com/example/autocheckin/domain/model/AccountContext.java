package com.example.autocheckin.domain.model;

import com.example.autocheckin.service.config.ConfigResolver;
import lombok.Builder;
import lombok.Value;

/**
 * Everything a worker needs to know about the account it serves:
 * identity for log correlation, the log destinations, and the configuration
 * layers reply policies are resolved from.
 */
@Value
@Builder
public class AccountContext {

    String label;
    String sessionName;
    AppConfig global;
    AccountConfig account;
    ConfigResolver configResolver;

    public static AccountContext of(AppConfig global, AccountConfig account, ConfigResolver configResolver) {
        return AccountContext.builder()
                .label(account.getLabel())
                .sessionName(account.getSessionName())
                .global(global)
                .account(account)
                .configResolver(configResolver)
                .build();
    }

    public LogConfig getLog() {
        return global.getLog();
    }

    /**
     * Resolve the reply policy for a task; recomputed on every call
     */
    public ReplyPolicy replyPolicyFor(Task task) {
        return configResolver.resolveReplyConfig(global, account, task);
    }
}
