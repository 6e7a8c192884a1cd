package org.cronpulse.cron;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinition;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import org.cronpulse.errors.ValidationException;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Five-field cron evaluation (minute, hour, day-of-month, month, day-of-week).
 * <p>
 * Supports {@code *}, {@code *}{@code /n}, {@code a-b} and comma lists in every field.
 * Evaluation happens in the job's own zone so daylight-saving shifts come from the tz database.
 * Stateless and thread-safe: identical inputs always give identical results.
 */
public final class CronEvaluator {

    public static final String DEFAULT_TIMEZONE = "UTC";

    private static final int FIELD_COUNT = 5;
    private static final CronDefinition DEFINITION = CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX);
    private static final CronParser PARSER = new CronParser(DEFINITION);

    /**
     * Earliest instant strictly after {@code after} that matches the expression in {@code timezone}.
     *
     * @throws ValidationException if the expression or zone is malformed, or the expression never fires
     */
    public Instant nextTrigger(String expression, String timezone, Instant after) {
        Objects.requireNonNull(after, "after");
        Cron cron = parse(expression);
        ZoneId zone = zone(timezone);
        ExecutionTime executionTime = ExecutionTime.forCron(cron);

        // cron has minute granularity; starting from the truncated minute keeps "strictly after" exact
        Instant cursor = after.truncatedTo(ChronoUnit.MINUTES);
        for (int i = 0; i < 3; i++) {
            Instant candidate = next(executionTime, ZonedDateTime.ofInstant(cursor, zone), expression);
            if (candidate.isAfter(after)) {
                return candidate;
            }
            cursor = candidate;
        }
        throw new IllegalStateException("cron evaluation did not advance past " + after + " for '" + expression + "'");
    }

    /**
     * Parses the expression and zone, failing fast with a descriptive message.
     */
    public void validate(String expression, String timezone) {
        parse(expression);
        zone(timezone);
    }

    public ZoneId zone(String timezone) {
        String tz = (timezone == null || timezone.isBlank()) ? DEFAULT_TIMEZONE : timezone.trim();
        try {
            return ZoneId.of(tz);
        } catch (DateTimeException e) {
            throw new ValidationException("timezone", "Unknown timezone '" + tz + "'", e);
        }
    }

    private static Cron parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new ValidationException("cron_expression", "cron expression is required");
        }
        int fields = expr.split("\\s+").length;
        if (fields != FIELD_COUNT) {
            throw new ValidationException("cron_expression",
                    "cron expression must have 5 fields (minute hour day-of-month month day-of-week), got "
                            + fields + ": '" + expr + "'");
        }
        try {
            Cron cron = PARSER.parse(expr);
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new ValidationException("cron_expression",
                    "Invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    private static Instant next(ExecutionTime executionTime, ZonedDateTime base, String expression) {
        Optional<ZonedDateTime> next = executionTime.nextExecution(base);
        return next.map(ZonedDateTime::toInstant)
                .orElseThrow(() -> new ValidationException("cron_expression",
                        "cron expression '" + expression + "' has no next execution time"));
    }
}
