// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.exceptions;

/**
 * Raised when a storage resource locator does not have the
 * {@code https://{account}.{queue|blob|table}.{domain}/{name}?{sas}} shape.
 */
public class MalformedResourceUriException extends IngestionClientException {
    private final String uri;

    public MalformedResourceUriException(String uri) {
        super(String.format("Failed to parse resource URI - invalid uri (%s)", uri));
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
