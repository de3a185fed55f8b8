package com.safee.jobs.scheduler;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Cron parsing on cron-utils. Five fields are classic UNIX cron (minute resolution);
 * six fields put seconds first, Spring style.
 */
public final class CronExpressions {
    private static final CronParser UNIX = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser WITH_SECONDS =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));

    private CronExpressions() {
    }

    /**
     * @throws IllegalArgumentException for a blank or malformed expression
     */
    public static Cron parse(String expression) {
        String expr = expression == null ? "" : expression.trim();
        if (expr.isEmpty()) {
            throw new IllegalArgumentException("cron expression is required");
        }
        int fields = expr.split("\\s+").length;
        CronParser parser;
        if (fields == 5) {
            parser = UNIX;
        } else if (fields == 6) {
            parser = WITH_SECONDS;
        } else {
            throw new IllegalArgumentException("cron expression must have 5 or 6 fields, got " + fields + ": " + expr);
        }
        try {
            Cron cron = parser.parse(expr);
            cron.validate();
            return cron;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    public static ZoneId zone(String timezone) {
        try {
            return ZoneId.of(timezone == null || timezone.isBlank() ? "UTC" : timezone.trim());
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid time zone: " + timezone, e);
        }
    }

    /** First fire strictly after {@code after}, evaluated in {@code zone}. */
    public static Optional<Instant> nextExecution(Cron cron, ZoneId zone, Instant after) {
        return ExecutionTime.forCron(cron)
                .nextExecution(ZonedDateTime.ofInstant(after, zone))
                .map(ZonedDateTime::toInstant);
    }

    /** Convenience for validation paths: parse and compute in one call. */
    public static Optional<Instant> nextExecution(String expression, String timezone, Instant after) {
        return nextExecution(parse(expression), zone(timezone), after);
    }
}
