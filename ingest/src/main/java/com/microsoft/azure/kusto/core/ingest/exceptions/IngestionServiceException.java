// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.exceptions;

import com.azure.core.exception.AzureException;

public class IngestionServiceException extends AzureException {
    private String ingestionSource;

    public String getIngestionSource() {
        return ingestionSource;
    }

    public IngestionServiceException(String message) {
        super(message);
    }

    public IngestionServiceException(String message, Exception exception) {
        super(message, exception);
    }

    public IngestionServiceException(String ingestionSource, String message, RuntimeException exception) {
        this(message, exception);
        this.ingestionSource = ingestionSource;
    }
}
