// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data.exceptions;

public class KustoParseException extends RuntimeException {

    public KustoParseException(String message) {
        super(message);
    }

    public KustoParseException(String message, Throwable cause) {
        super(message, cause);
    }

}
