package com.triggerd.service;

import com.triggerd.config.TriggerdProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Parses classic 5-field cron expressions and computes the next fire time.
 *
 * Spring's CronExpression wants a leading seconds field; we accept only the
 * classic form (minute hour day-of-month month day-of-week) and pin seconds
 * to 0, so "30 * * * *" fires at hh:30:00 every hour.
 *
 * Spring requires day-of-month and day-of-week to both match, where classic
 * cron fires when either does. Expressions restricting both are rejected.
 *
 * Expressions are evaluated in triggerd.scheduler.cron-zone (UTC by default).
 */
@Component
@RequiredArgsConstructor
public class CronSchedules {

    private static final int CRON_FIELDS = 5;
    private static final int DAY_OF_MONTH = 2;
    private static final int DAY_OF_WEEK = 4;

    private final TriggerdProperties properties;

    /**
     * Throws {@link InvalidCronExpressionException} if the expression cannot be used.
     */
    public void validate(String expression) {
        parse(expression);
    }

    public boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    /**
     * The first occurrence strictly after {@code from}.
     */
    public Instant nextAfter(String expression, Instant from) {
        ZonedDateTime next = parse(expression)
                .next(from.atZone(properties.getScheduler().getCronZone()));
        if (next == null) {
            throw new InvalidCronExpressionException(expression, "schedule never fires");
        }
        return next.toInstant();
    }

    private CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(expression, "expression is empty");
        }
        String[] fields = expression.trim().split("\\s+");
        if (fields.length != CRON_FIELDS) {
            throw new InvalidCronExpressionException(expression,
                    "expected 5 fields (minute hour day-of-month month day-of-week), got "
                            + fields.length);
        }
        if (isRestricted(fields[DAY_OF_MONTH]) && isRestricted(fields[DAY_OF_WEEK])) {
            throw new InvalidCronExpressionException(expression,
                    "day-of-month and day-of-week cannot both be restricted; use * for one of them");
        }
        try {
            return CronExpression.parse("0 " + String.join(" ", fields));
        } catch (IllegalArgumentException e) {
            throw new InvalidCronExpressionException(expression, e.getMessage());
        }
    }

    private static boolean isRestricted(String field) {
        return !"*".equals(field) && !"?".equals(field);
    }
}
