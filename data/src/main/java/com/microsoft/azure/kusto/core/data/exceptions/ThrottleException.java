package com.microsoft.azure.kusto.core.data.exceptions;

public class ThrottleException extends DataServiceException {
    public static final String ERROR_MESSAGE = "Request was throttled, too many requests.";

    public ThrottleException(String ingestionSource) {
        super(ingestionSource, ERROR_MESSAGE, null, false, 429);
    }
}
