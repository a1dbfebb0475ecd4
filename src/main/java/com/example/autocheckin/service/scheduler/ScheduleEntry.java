package com.example.autocheckin.service.scheduler;

import lombok.Value;
import org.springframework.scheduling.Trigger;

/**
 * Binding of one parsed schedule expression to one trigger callback
 */
@Value
public class ScheduleEntry {

    int id;
    String expression;
    Trigger trigger;
    TaskTrigger taskTrigger;
}
