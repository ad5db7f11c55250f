// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data.exceptions;

import org.jetbrains.annotations.Nullable;

/*
  This class represents an error returned by the service, e.g. a non-successful http status or a failed command
 */
public class DataServiceException extends KustoDataExceptionBase {
    private final Integer statusCode;

    public DataServiceException(String ingestionSource, String message, boolean isPermanent) {
        this(ingestionSource, message, null, isPermanent);
    }

    public DataServiceException(String ingestionSource, String message, Exception exception, boolean isPermanent) {
        this(ingestionSource, message, exception, isPermanent, null);
    }

    public DataServiceException(String ingestionSource, String message, Exception exception, boolean isPermanent, @Nullable Integer statusCode) {
        super(ingestionSource, message, exception, isPermanent);
        this.statusCode = statusCode;
    }

    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean is404Error() {
        return statusCode != null && statusCode == 404;
    }
}
