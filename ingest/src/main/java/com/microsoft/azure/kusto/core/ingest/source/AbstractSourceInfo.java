// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.source;

import java.util.UUID;

abstract class AbstractSourceInfo implements SourceInfo {
    private UUID sourceId;

    // An estimation of the raw (uncompressed, un-indexed) size of the data, 0 when unknown
    private long rawSizeInBytes;

    public UUID getSourceId() {
        return sourceId;
    }

    public void setSourceId(UUID sourceId) {
        this.sourceId = sourceId;
    }

    public long getRawSizeInBytes() {
        return rawSizeInBytes;
    }

    public void setRawSizeInBytes(long rawSizeInBytes) {
        this.rawSizeInBytes = rawSizeInBytes;
    }
}
