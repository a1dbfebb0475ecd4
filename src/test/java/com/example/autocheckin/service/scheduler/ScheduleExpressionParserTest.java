package com.example.autocheckin.service.scheduler;

import com.example.autocheckin.exception.ScheduleException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.scheduling.support.PeriodicTrigger;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScheduleExpressionParser Tests")
class ScheduleExpressionParserTest {

    private final ScheduleExpressionParser parser = new ScheduleExpressionParser();

    @Nested
    @DisplayName("Cron expressions")
    class CronTests {

        @Test
        @DisplayName("Should accept a standard five-field expression")
        void shouldAcceptFiveFields() {
            var trigger = parser.parse("0 8 * * *");

            assertThat(trigger).isInstanceOf(CronTrigger.class);
            assertThat(((CronTrigger) trigger).getExpression()).isEqualTo("0 0 8 * * *");
        }

        @ParameterizedTest
        @ValueSource(strings = {"@daily", "@hourly", "@weekly", "@monthly", "@yearly", "@annually", "@midnight"})
        @DisplayName("Should accept descriptors")
        void shouldAcceptDescriptors(String expression) {
            assertThat(parser.parse(expression)).isInstanceOf(CronTrigger.class);
        }

        @ParameterizedTest
        @ValueSource(strings = {"not-a-cron", "* * * *", "0 0 8 * * *", "61 8 * * *", "@sometimes"})
        @DisplayName("Should reject malformed expressions")
        void shouldRejectMalformed(String expression) {
            assertThatThrownBy(() -> parser.parse(expression))
                    .isInstanceOf(ScheduleException.class)
                    .hasMessageContaining(expression);
        }

        @Test
        @DisplayName("Should reject an empty expression")
        void shouldRejectEmpty() {
            assertThatThrownBy(() -> parser.parse("  "))
                    .isInstanceOf(ScheduleException.class);
        }
    }

    @Nested
    @DisplayName("Interval expressions")
    class IntervalTests {

        @Test
        @DisplayName("Should accept @every with a fixed rate and an initial delay of one period")
        void shouldAcceptEvery() {
            var trigger = parser.parse("@every 1h30m");

            assertThat(trigger).isInstanceOf(PeriodicTrigger.class);
            var periodic = (PeriodicTrigger) trigger;
            assertThat(periodic.getPeriodDuration()).isEqualTo(Duration.ofMinutes(90));
            assertThat(periodic.getInitialDelayDuration()).isEqualTo(Duration.ofMinutes(90));
            assertThat(periodic.isFixedRate()).isTrue();
        }

        @Test
        @DisplayName("Should parse compound and fractional durations")
        void shouldParseDurations() {
            assertThat(ScheduleExpressionParser.parseDuration("x", "45s")).isEqualTo(Duration.ofSeconds(45));
            assertThat(ScheduleExpressionParser.parseDuration("x", "500ms")).isEqualTo(Duration.ofMillis(500));
            assertThat(ScheduleExpressionParser.parseDuration("x", "1.5h")).isEqualTo(Duration.ofMinutes(90));
            assertThat(ScheduleExpressionParser.parseDuration("x", "2h3m4s")).isEqualTo(Duration.ofSeconds(7384));
        }

        @Test
        @DisplayName("Should reject an interval too large to represent in nanoseconds")
        void shouldRejectOverflowingInterval() {
            assertThatThrownBy(() -> parser.parse("@every 9999999999h"))
                    .isInstanceOf(ScheduleException.class)
                    .hasMessageContaining("out of range");
            assertThat(ScheduleExpressionParser.parseDuration("x", "2562047h")).isEqualTo(Duration.ofHours(2562047));
        }

        @ParameterizedTest
        @ValueSource(strings = {"@every", "@every 0s", "@every 10", "@every 5x", "@every 1h 30m"})
        @DisplayName("Should reject missing, zero or malformed intervals")
        void shouldRejectBadIntervals(String expression) {
            assertThatThrownBy(() -> parser.parse(expression))
                    .isInstanceOf(ScheduleException.class);
        }
    }
}
