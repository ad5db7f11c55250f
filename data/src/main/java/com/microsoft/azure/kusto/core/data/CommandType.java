package com.microsoft.azure.kusto.core.data;

public enum CommandType {
    ADMIN_COMMAND("%s/" + ClientImpl.MGMT_ENDPOINT_VERSION + "/rest/mgmt", "AdminCommand", ResponseProtocol.V1),
    QUERY("%s/" + ClientImpl.QUERY_ENDPOINT_VERSION + "/rest/query", "QueryCommand", ResponseProtocol.V2);

    private final String endpoint;
    private final String activityTypeSuffix;
    private final ResponseProtocol protocol;

    CommandType(String endpoint, String activityTypeSuffix, ResponseProtocol protocol) {
        this.endpoint = endpoint;
        this.activityTypeSuffix = activityTypeSuffix;
        this.protocol = protocol;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getActivityTypeSuffix() {
        return activityTypeSuffix;
    }

    public ResponseProtocol getProtocol() {
        return protocol;
    }
}
