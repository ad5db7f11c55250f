package com.microsoft.azure.kusto.core.ingest.resources;

import java.util.Locale;

public enum StorageObjectType {
    QUEUE("queue", "QueueEndpoint"),
    BLOB("blob", "BlobEndpoint"),
    TABLE("table", "TableEndpoint");

    private final String name;
    private final String endpointKey;

    StorageObjectType(String name, String endpointKey) {
        this.name = name;
        this.endpointKey = endpointKey;
    }

    public String getName() {
        return name;
    }

    String getEndpointKey() {
        return endpointKey;
    }

    public static StorageObjectType fromName(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        for (StorageObjectType type : values()) {
            if (type.name.equals(lowered)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown storage object type: " + name);
    }
}
