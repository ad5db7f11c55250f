// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.source;

import static com.microsoft.azure.kusto.core.data.Ensure.stringIsNotBlank;

import java.util.UUID;

public class BlobSourceInfo extends AbstractSourceInfo {
    private String blobPath;

    /**
     * @param blobPath the full blob URI, including a SAS token unless the service can read it otherwise
     */
    public BlobSourceInfo(String blobPath) {
        this.blobPath = blobPath;
    }

    public BlobSourceInfo(String blobPath, long rawSizeInBytes) {
        this(blobPath, rawSizeInBytes, null);
    }

    public BlobSourceInfo(String blobPath, long rawSizeInBytes, UUID sourceId) {
        setBlobPath(blobPath);
        setRawSizeInBytes(rawSizeInBytes);
        setSourceId(sourceId);
    }

    public String getBlobPath() {
        return blobPath;
    }

    public void setBlobPath(String blobPath) {
        this.blobPath = blobPath;
    }

    public void validate() {
        stringIsNotBlank(blobPath, "blobPath");
    }

    @Override
    public String toString() {
        return String.format("Blob %s with SourceId: %s", blobPath.split("\\?")[0], getSourceId());
    }
}
