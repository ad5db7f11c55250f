// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data.exceptions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.azure.core.exception.AzureException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

/*
  This class represents an error that returned from the query result
 */
public class KustoServiceQueryError extends AzureException {
    static final String EXCEPTIONS_MESSAGE = "Query execution failed with multiple inner exceptions:\n";

    private final List<String> exceptions;
    private final List<OneApiError> apiErrors;

    public KustoServiceQueryError(String message, List<String> exceptions, List<OneApiError> apiErrors) {
        super(message);
        this.exceptions = exceptions;
        this.apiErrors = apiErrors;
    }

    public KustoServiceQueryError(String message) {
        this(message, Collections.singletonList(message), Collections.emptyList());
    }

    public static KustoServiceQueryError fromOneApiErrorArray(ArrayNode jsonExceptions, boolean isOneApi) {
        if (jsonExceptions == null || jsonExceptions.isEmpty()) {
            return new KustoServiceQueryError("No exceptions were returned from the service.");
        }

        List<String> exceptions = new ArrayList<>();
        List<OneApiError> apiErrors = new ArrayList<>();
        StringBuilder sb = new StringBuilder();
        if (jsonExceptions.size() > 1) {
            sb.append(EXCEPTIONS_MESSAGE);
        }

        for (JsonNode jsonNode : jsonExceptions) {
            String value = jsonNode.isTextual() ? jsonNode.asText() : jsonNode.toString();
            String message = value;
            if (isOneApi && jsonNode.isObject()) {
                OneApiError apiError = OneApiError.fromJsonObject(jsonNode);
                apiErrors.add(apiError);
                message = apiError.getCode() + ": " + apiError.getMessage();
            }
            exceptions.add(value);
            sb.append(message);
            sb.append("\n");
        }

        return new KustoServiceQueryError(sb.toString(), exceptions, apiErrors);
    }

    /**
     * Builds the error surfaced for a response whose status table reports failures.
     */
    public static KustoServiceQueryError fromStatusTableExceptions(List<String> exceptions) {
        String message = "Kusto request had errors. " + String.join("\n", exceptions);
        return new KustoServiceQueryError(message, new ArrayList<>(exceptions), Collections.emptyList());
    }

    public List<String> getExceptions() {
        return exceptions;
    }

    public List<OneApiError> getApiErrors() {
        return apiErrors;
    }

    @Override
    public String toString() {
        return exceptions.isEmpty() ? getMessage() : "exceptions\":" + exceptions + "}";
    }

    public boolean isPermanent() {
        return !apiErrors.isEmpty() && apiErrors.get(0).isPermanent();
    }
}
