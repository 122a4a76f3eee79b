package com.triggerd.service;

public class InvalidCronExpressionException extends TriggerConfigurationException {

    private final String expression;

    public InvalidCronExpressionException(String expression, String reason) {
        super("Invalid cron schedule '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
