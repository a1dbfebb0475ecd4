package com.example.autocheckin.service.session;

import com.example.autocheckin.domain.model.AccountConfig;
import com.example.autocheckin.domain.model.AccountPlan;
import com.example.autocheckin.domain.model.Task;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Splits an account's configured tasks into what runs on start, what is
 * scheduled and what is skipped because it is disabled.
 */
@Slf4j
@Component
public class AccountPlanner {

    public AccountPlan plan(AccountConfig account) {
        var plan = AccountPlan.builder().accountLabel(account.getLabel());

        for (var config : account.getTasks()) {
            var task = Task.from(config);
            if (!task.isEnabled()) {
                log.info("Task {} is disabled, skipping (account: {})", task.getDisplayName(), account.getLabel());
                plan.disabledTask(task);
                continue;
            }
            plan.enabledTask(task);
            if (task.isRunOnStart()) {
                plan.startupTask(task);
            }
            if (task.hasSchedule()) {
                plan.scheduledTask(task);
            }
        }
        return plan.build();
    }
}
