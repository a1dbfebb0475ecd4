package com.example.autocheckin.service.executor;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import lombok.RequiredArgsConstructor;

/**
 * Passes only events logged while the MDC key holds the expected value.
 */
@RequiredArgsConstructor
class MdcValueFilter extends Filter<ILoggingEvent> {

    private final String key;
    private final String expectedValue;

    @Override
    public FilterReply decide(ILoggingEvent event) {
        var value = event.getMDCPropertyMap().get(key);
        return expectedValue.equals(value) ? FilterReply.NEUTRAL : FilterReply.DENY;
    }
}
