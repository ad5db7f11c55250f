// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/*
 * Kusto supports attaching various properties to client requests (such as queries and control commands).
 * Options change how the service runs the request, parameters bind values to a parameterized query, and the
 * client request id, application and user are sent as headers to correlate client and service logs.
 */
public class ClientRequestProperties {
    public static final String OPTION_SERVER_TIMEOUT = "servertimeout";
    // When set, errors in the status table are returned with the partial results instead of failing the request
    public static final String OPTION_DEFER_PARTIAL_QUERY_FAILURES = "deferpartialqueryfailures";

    private static final String OPTIONS_KEY = "Options";
    private static final String PARAMETERS_KEY = "Parameters";
    static final long MIN_TIMEOUT_MS = TimeUnit.MINUTES.toMillis(1);
    static final long MAX_TIMEOUT_MS = TimeUnit.HOURS.toMillis(1);

    private final Map<String, Object> parameters = new HashMap<>();
    private final Map<String, Object> options = new HashMap<>();
    private String clientRequestId;
    private String application;
    private String user;

    public void setOption(String name, Object value) {
        Ensure.stringIsNotBlank(name, "name");
        options.put(name, value);
    }

    public Object getOption(String name) {
        return options.get(name);
    }

    public void removeOption(String name) {
        options.remove(name);
    }

    public void setParameter(String name, Object value) {
        Ensure.stringIsNotBlank(name, "name");
        Ensure.argIsNotNull(value, "value");
        parameters.put(name, value instanceof Duration ? TimeUtils.formatDurationAsTimespan((Duration) value) : value);
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    /**
     * Sets the amount of time a request may execute on the service. Values are clamped to between 1 minute and 1 hour.
     */
    public void setTimeoutInMilliSec(long timeoutInMs) {
        options.put(OPTION_SERVER_TIMEOUT, Math.max(MIN_TIMEOUT_MS, Math.min(MAX_TIMEOUT_MS, timeoutInMs)));
    }

    public Long getTimeoutInMilliSec() {
        Object timeout = getOption(OPTION_SERVER_TIMEOUT);
        if (timeout instanceof Number) {
            return ((Number) timeout).longValue();
        }
        if (timeout instanceof String) {
            Duration duration = TimeUtils.parseTimespan((String) timeout);
            return duration == null ? null : Math.max(MIN_TIMEOUT_MS, Math.min(MAX_TIMEOUT_MS, duration.toMillis()));
        }
        return null;
    }

    public boolean isDeferPartialQueryFailures() {
        Object value = getOption(OPTION_DEFER_PARTIAL_QUERY_FAILURES);
        return value instanceof Boolean ? (Boolean) value : value != null && Boolean.parseBoolean(value.toString());
    }

    public void setDeferPartialQueryFailures(boolean defer) {
        setOption(OPTION_DEFER_PARTIAL_QUERY_FAILURES, defer);
    }

    public String getClientRequestId() {
        return clientRequestId;
    }

    public void setClientRequestId(String clientRequestId) {
        this.clientRequestId = clientRequestId;
    }

    public String getApplication() {
        return application;
    }

    public void setApplication(String application) {
        this.application = application;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    JsonNode toJson() {
        ObjectMapper objectMapper = Utils.getObjectMapper();
        ObjectNode optionsAsJson = objectMapper.valueToTree(options);
        Long timeout = getTimeoutInMilliSec();
        if (timeout != null) {
            optionsAsJson.put(OPTION_SERVER_TIMEOUT, TimeUtils.formatDurationAsTimespan(Duration.ofMillis(timeout)));
        }

        ObjectNode json = objectMapper.createObjectNode();
        json.set(OPTIONS_KEY, optionsAsJson);
        json.set(PARAMETERS_KEY, objectMapper.valueToTree(parameters));
        return json;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }
}
