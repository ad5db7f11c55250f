// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.source;

import java.io.InputStream;
import java.util.Objects;
import java.util.UUID;

import com.microsoft.azure.kusto.core.data.Ensure;

public class StreamSourceInfo extends AbstractSourceInfo {

    private InputStream stream;
    private boolean leaveOpen = false;
    private boolean gzipCompressed = false;

    public StreamSourceInfo(InputStream stream) {
        setStream(stream);
    }

    public StreamSourceInfo(InputStream stream, boolean leaveOpen) {
        this(stream);
        setLeaveOpen(leaveOpen);
    }

    public StreamSourceInfo(InputStream stream, boolean leaveOpen, UUID sourceId) {
        this(stream, leaveOpen);
        setSourceId(sourceId);
    }

    public StreamSourceInfo(InputStream stream, boolean leaveOpen, UUID sourceId, boolean gzipCompressed) {
        this(stream, leaveOpen, sourceId);
        setGzipCompressed(gzipCompressed);
    }

    public InputStream getStream() {
        return stream;
    }

    public void setStream(InputStream stream) {
        this.stream = Objects.requireNonNull(stream, "stream cannot be null");
    }

    public boolean isLeaveOpen() {
        return leaveOpen;
    }

    /**
     * Whether or not the stream is left open after reading from it.
     * @param leaveOpen leave the stream open after processing
     */
    public void setLeaveOpen(boolean leaveOpen) {
        this.leaveOpen = leaveOpen;
    }

    public boolean isGzipCompressed() {
        return gzipCompressed;
    }

    /**
     * Marks the stream content as already gzip compressed; the uploaded blob is then named with a ".gz" suffix.
     */
    public void setGzipCompressed(boolean gzipCompressed) {
        this.gzipCompressed = gzipCompressed;
    }

    public void validate() {
        Ensure.argIsNotNull(stream, "stream");
    }

    @Override
    public String toString() {
        return String.format("Stream with SourceId: %s", getSourceId());
    }
}
