// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data.exceptions;

import com.fasterxml.jackson.databind.JsonNode;

public class OneApiError {
    private static final String EMPTY_STRING = "";

    public OneApiError(String code, String message, String description, String type, JsonNode context, boolean permanent) {
        this.code = code;
        this.message = message;
        this.description = description;
        this.type = type;
        this.context = context;
        this.permanent = permanent;
    }

    /**
     * Reads a single OneApi error. Accepts either the error object itself or a wrapper holding it under "error".
     */
    public static OneApiError fromJsonObject(JsonNode jsonObject) {
        JsonNode error = jsonObject.has("error") ? jsonObject.get("error") : jsonObject;
        return new OneApiError(
                textOrEmpty(error, "code"),
                textOrEmpty(error, "message"),
                textOrEmpty(error, "@message"),
                textOrEmpty(error, "@type"),
                error.get("@context"),
                error.has("@permanent") && error.get("@permanent").asBoolean());
    }

    private static String textOrEmpty(JsonNode node, String property) {
        JsonNode value = node.get(property);
        return value == null || value.isNull() ? EMPTY_STRING : value.asText();
    }

    private final String code;
    private final String message;
    private final String description;
    private final String type;
    private final JsonNode context;
    private final boolean permanent;

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public String getDescription() {
        return description;
    }

    public String getType() {
        return type;
    }

    public JsonNode getContext() {
        return context;
    }

    public boolean isPermanent() {
        return permanent;
    }
}
