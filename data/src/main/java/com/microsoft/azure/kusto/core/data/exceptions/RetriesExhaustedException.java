package com.microsoft.azure.kusto.core.data.exceptions;

/*
  Thrown once a retry budget is spent; the last failure, when known, is kept as the cause
 */
public class RetriesExhaustedException extends KustoDataExceptionBase {
    private final int attempts;

    public RetriesExhaustedException(String message, int attempts) {
        this(null, message, null, attempts);
    }

    public RetriesExhaustedException(String ingestionSource, String message, Exception lastFailure, int attempts) {
        super(ingestionSource, message, lastFailure, true);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
