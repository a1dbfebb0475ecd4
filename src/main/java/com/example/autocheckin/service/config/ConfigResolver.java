package com.example.autocheckin.service.config;

import com.example.autocheckin.domain.model.AccountConfig;
import com.example.autocheckin.domain.model.AppConfig;
import com.example.autocheckin.domain.model.AppCredentials;
import com.example.autocheckin.domain.model.LogConfig;
import com.example.autocheckin.domain.model.ReplyPolicy;
import com.example.autocheckin.domain.model.Task;
import com.example.autocheckin.domain.model.TaskConfig;
import com.example.autocheckin.exception.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Merges configuration sources and resolves layered policy values.
 * <p>
 * Merge rules (sparse override, never full replacement):
 * - scalars: the override wins only when it is non-empty / non-zero
 * - accounts: by name when every account on both sides is named, otherwise
 *   by index, which requires both sides to have the same length
 * - tasks: by index, padded with whichever side is longer
 * <p>
 * All operations are pure; inputs are never modified.
 */
@Slf4j
@Component
public class ConfigResolver {

    /**
     * Fold overrides over a base configuration, left to right.
     */
    public AppConfig resolve(AppConfig base, List<AppConfig> overrides) {
        var merged = base;
        for (var override : overrides) {
            merged = merge(merged, override);
        }
        return merged;
    }

    public AppConfig merge(AppConfig base, AppConfig override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }

        var merged = base.toBuilder()
                .accounts(new ArrayList<>(base.getAccounts()))
                .log(mergeLog(base.getLog(), override.getLog()));

        if (hasText(override.getProxy())) {
            merged.proxy(override.getProxy());
        }
        if (override.getAppId() != 0) {
            merged.appId(override.getAppId());
        }
        if (hasText(override.getAppHash())) {
            merged.appHash(override.getAppHash());
        }
        if (override.getReplyWaitSeconds() != 0) {
            merged.replyWaitSeconds(override.getReplyWaitSeconds());
        }
        if (override.getReplyHistoryLimit() != 0) {
            merged.replyHistoryLimit(override.getReplyHistoryLimit());
        }
        if (hasText(override.getLanguage())) {
            merged.language(override.getLanguage());
        }
        if (!override.getAccounts().isEmpty()) {
            merged.accounts(mergeAccounts(base.getAccounts(), override.getAccounts()));
        }

        return merged.build();
    }

    /**
     * @throws ConfigException if the accounts cannot be matched by name and the lengths differ
     */
    public List<AccountConfig> mergeAccounts(List<AccountConfig> base, List<AccountConfig> override) {
        if (override == null || override.isEmpty()) {
            return new ArrayList<>(base);
        }
        if (base == null || base.isEmpty()) {
            return new ArrayList<>(override);
        }
        if (allAccountsNamed(base) && allAccountsNamed(override)) {
            log.debug("Merging {} override accounts into {} base accounts by name", override.size(), base.size());
            return mergeAccountsByName(base, override);
        }
        if (base.size() != override.size()) {
            throw new ConfigException(String.format(
                    "accounts length mismatch: base=%d override=%d", base.size(), override.size()));
        }
        log.debug("Merging {} accounts by index", base.size());
        return mergeByIndex(base, override, this::mergeAccount);
    }

    public AccountConfig mergeAccount(AccountConfig base, AccountConfig override) {
        var merged = base.toBuilder()
                .tasks(new ArrayList<>(base.getTasks()));

        if (hasText(override.getName())) {
            merged.name(override.getName());
        }
        if (hasText(override.getPhone())) {
            merged.phone(override.getPhone());
        }
        if (hasText(override.getPassword())) {
            merged.password(override.getPassword());
        }
        if (override.getAppId() != 0) {
            merged.appId(override.getAppId());
        }
        if (hasText(override.getAppHash())) {
            merged.appHash(override.getAppHash());
        }
        if (override.getWorkerCount() != 0) {
            merged.workerCount(override.getWorkerCount());
        }
        if (override.getTaskQueueSize() != 0) {
            merged.taskQueueSize(override.getTaskQueueSize());
        }
        if (override.getReplyWaitSeconds() != 0) {
            merged.replyWaitSeconds(override.getReplyWaitSeconds());
        }
        if (override.getReplyHistoryLimit() != 0) {
            merged.replyHistoryLimit(override.getReplyHistoryLimit());
        }
        if (!override.getTasks().isEmpty()) {
            merged.tasks(mergeByIndex(base.getTasks(), override.getTasks(), this::mergeTask));
        }

        return merged.build();
    }

    public TaskConfig mergeTask(TaskConfig base, TaskConfig override) {
        var merged = base.toBuilder();

        if (hasText(override.getName())) {
            merged.name(override.getName());
        }
        if (hasText(override.getTarget())) {
            merged.target(override.getTarget());
        }
        if (hasText(override.getMethod())) {
            merged.method(override.getMethod());
        }
        if (hasText(override.getPayload())) {
            merged.payload(override.getPayload());
        }
        if (hasText(override.getSchedule())) {
            merged.schedule(override.getSchedule());
        }
        if (override.getEnabled() != null) {
            merged.enabled(override.getEnabled());
        }
        // false is indistinguishable from absent, so an override can only switch run_on_start on
        if (override.isRunOnStart()) {
            merged.runOnStart(true);
        }
        if (override.getReplyWaitSeconds() != 0) {
            merged.replyWaitSeconds(override.getReplyWaitSeconds());
        }
        if (override.getReplyHistoryLimit() != 0) {
            merged.replyHistoryLimit(override.getReplyHistoryLimit());
        }

        return merged.build();
    }

    /**
     * Reply policy for account-level use (no task override).
     */
    public ReplyPolicy resolveReplyConfig(AppConfig global, AccountConfig account) {
        return resolveReplyConfig(global, account, null);
    }

    /**
     * Resolve reply wait and history limit, each field independently:
     * task &gt; account &gt; global &gt; default (3 seconds, 10 messages).
     * A value only counts when it is greater than zero.
     */
    public ReplyPolicy resolveReplyConfig(AppConfig global, AccountConfig account, Task task) {
        var waitSeconds = firstPositive(
                task != null ? task.getReplyWaitSeconds() : 0,
                account != null ? account.getReplyWaitSeconds() : 0,
                global != null ? global.getReplyWaitSeconds() : 0,
                ReplyPolicy.DEFAULT_WAIT_SECONDS);
        var historyLimit = firstPositive(
                task != null ? task.getReplyHistoryLimit() : 0,
                account != null ? account.getReplyHistoryLimit() : 0,
                global != null ? global.getReplyHistoryLimit() : 0,
                ReplyPolicy.DEFAULT_HISTORY_LIMIT);
        return new ReplyPolicy(waitSeconds, historyLimit);
    }

    /**
     * Account credentials first, global ones as fallback.
     *
     * @throws ConfigException if app_id or app_hash is still missing
     */
    public AppCredentials resolveAppCredentials(AppConfig global, AccountConfig account) {
        var appId = account.getAppId() != 0 ? account.getAppId() : global.getAppId();
        var appHash = hasText(account.getAppHash()) ? account.getAppHash() : global.getAppHash();
        if (appId == 0 || !hasText(appHash)) {
            throw new ConfigException("missing app_id or app_hash");
        }
        return new AppCredentials(appId, appHash);
    }

    private LogConfig mergeLog(LogConfig base, LogConfig override) {
        var merged = base.toBuilder();
        if (hasText(override.getDir())) {
            merged.dir(override.getDir());
        }
        if (hasText(override.getLevel())) {
            merged.level(override.getLevel());
        }
        if (hasText(override.getFormat())) {
            merged.format(override.getFormat());
        }
        return merged.build();
    }

    private List<AccountConfig> mergeAccountsByName(List<AccountConfig> base, List<AccountConfig> override) {
        var overrideIndex = new LinkedHashMap<String, AccountConfig>();
        for (var account : override) {
            overrideIndex.put(account.getName().trim(), account);
        }

        var merged = new ArrayList<AccountConfig>(base.size() + override.size());
        var seen = new HashSet<String>();
        for (var account : base) {
            var key = account.getName().trim();
            var match = overrideIndex.get(key);
            if (match != null) {
                merged.add(mergeAccount(account, match));
                seen.add(key);
            } else {
                merged.add(account);
            }
        }

        for (var entry : overrideIndex.entrySet()) {
            if (!seen.contains(entry.getKey())) {
                merged.add(entry.getValue());
            }
        }
        return merged;
    }

    private static <T> List<T> mergeByIndex(List<T> base, List<T> override, BiFunction<T, T, T> mergeOne) {
        var size = Math.max(base.size(), override.size());
        var merged = new ArrayList<T>(size);
        for (var i = 0; i < size; i++) {
            var hasBase = i < base.size();
            var hasOverride = i < override.size();
            if (hasBase && hasOverride) {
                merged.add(mergeOne.apply(base.get(i), override.get(i)));
            } else if (hasBase) {
                merged.add(base.get(i));
            } else {
                merged.add(override.get(i));
            }
        }
        return merged;
    }

    private static boolean allAccountsNamed(List<AccountConfig> accounts) {
        if (accounts.isEmpty()) {
            return false;
        }
        return accounts.stream().allMatch(AccountConfig::hasName);
    }

    private static int firstPositive(int... values) {
        for (var value : values) {
            if (value > 0) {
                return value;
            }
        }
        return 0;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
