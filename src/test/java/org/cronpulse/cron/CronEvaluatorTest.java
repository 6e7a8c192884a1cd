package org.cronpulse.cron;

import org.cronpulse.errors.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CronEvaluatorTest {

    private final CronEvaluator cron = new CronEvaluator();

    @Test
    void nextTrigger_shouldReturnNextHalfHourForStepExpression() {
        Instant next = cron.nextTrigger("*/30 * * * *", "UTC", Instant.parse("2024-05-01T10:05:00Z"));
        assertEquals(Instant.parse("2024-05-01T10:30:00Z"), next);
    }

    @Test
    void nextTrigger_shouldBeStrictlyAfterReferenceOnExactMatch() {
        Instant next = cron.nextTrigger("*/30 * * * *", "UTC", Instant.parse("2024-05-01T10:30:00Z"));
        assertEquals(Instant.parse("2024-05-01T11:00:00Z"), next);
    }

    @Test
    void nextTrigger_shouldSkipMatchingMinuteWhenReferenceHasSeconds() {
        Instant next = cron.nextTrigger("*/30 * * * *", "UTC", Instant.parse("2024-05-01T10:30:15.250Z"));
        assertEquals(Instant.parse("2024-05-01T11:00:00Z"), next);
    }

    @Test
    void nextTrigger_shouldSupportListsAndRanges() {
        Instant next = cron.nextTrigger("0,15 8-9 * * *", "UTC", Instant.parse("2024-05-01T08:20:00Z"));
        assertEquals(Instant.parse("2024-05-01T09:00:00Z"), next);
    }

    @Test
    void nextTrigger_shouldEvaluateInJobTimezoneAcrossDaylightSavingChange() {
        // Friday 10:00 EST; US clocks moved forward on Sunday 2024-03-10
        Instant next = cron.nextTrigger("0 9 * * 1-5", "America/New_York", Instant.parse("2024-03-08T15:00:00Z"));
        // Monday 09:00 EDT (UTC-4)
        assertEquals(Instant.parse("2024-03-11T13:00:00Z"), next);
    }

    @Test
    void nextTrigger_shouldDefaultBlankTimezoneToUtc() {
        Instant next = cron.nextTrigger("0 12 * * *", " ", Instant.parse("2024-05-01T10:00:00Z"));
        assertEquals(Instant.parse("2024-05-01T12:00:00Z"), next);
    }

    @Test
    void nextTrigger_shouldBeDeterministic() {
        Instant after = Instant.parse("2024-07-14T23:59:59Z");
        Instant first = cron.nextTrigger("5 4 * * 0", "Europe/Berlin", after);
        Instant second = cron.nextTrigger("5 4 * * 0", "Europe/Berlin", after);
        assertEquals(first, second);
    }

    @Test
    void nextTrigger_shouldAlwaysBeAfterReference() {
        String[] expressions = {"* * * * *", "*/7 * * * *", "0 0 1 * *", "15 3 * * 1-5", "0 0 29 2 *"};
        Instant start = Instant.parse("2023-12-31T22:17:43Z");
        for (String expr : expressions) {
            for (int i = 0; i < 50; i++) {
                Instant after = start.plus(Duration.ofMinutes(137L * i)).plusSeconds(i);
                Instant next = cron.nextTrigger(expr, "Asia/Kolkata", after);
                assertTrue(next.isAfter(after), expr + " at " + after + " gave " + next);
            }
        }
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"* * *", "* * * * * *", "61 * * * *", "* 25 * * *", "a b c d e"})
    void validate_shouldRejectMalformedExpressions(String expression) {
        ValidationException e = assertThrows(ValidationException.class, () -> cron.validate(expression, "UTC"));
        assertEquals("cron_expression", e.getField());
    }

    @Test
    void validate_shouldRejectUnknownTimezone() {
        ValidationException e = assertThrows(ValidationException.class, () -> cron.validate("* * * * *", "Mars/Olympus_Mons"));
        assertEquals("timezone", e.getField());
    }
}
