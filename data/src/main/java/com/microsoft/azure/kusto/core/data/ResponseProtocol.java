package com.microsoft.azure.kusto.core.data;

/**
 * Wire protocol of a response: V1 for management commands, V2 for queries. Each version names the status table
 * columns holding the severity, the correlation id and the description of a status row.
 */
public enum ResponseProtocol {
    V1("1.0", "Severity", "ClientActivityId", "StatusDescription"),
    V2("2.0", "Level", "ClientRequestId", "Payload");

    private final String version;
    private final String errorColumn;
    private final String cridColumn;
    private final String statusColumn;

    ResponseProtocol(String version, String errorColumn, String cridColumn, String statusColumn) {
        this.version = version;
        this.errorColumn = errorColumn;
        this.cridColumn = cridColumn;
        this.statusColumn = statusColumn;
    }

    public String getVersion() {
        return version;
    }

    public String getErrorColumn() {
        return errorColumn;
    }

    public String getCridColumn() {
        return cridColumn;
    }

    public String getStatusColumn() {
        return statusColumn;
    }
}
