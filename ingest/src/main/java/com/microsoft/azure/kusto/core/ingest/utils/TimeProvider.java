package com.microsoft.azure.kusto.core.ingest.utils;

public interface TimeProvider {
    long currentTimeMillis();
}
