package com.microsoft.azure.kusto.core.data.http;

public class HttpStatus {
    private HttpStatus() {
    }

    public static final int OK = 200;
    public static final int UNAUTHORIZED = 401;
    public static final int FORBIDDEN = 403;
    public static final int NOT_FOUND = 404;
    public static final int TOO_MANY_REQS = 429;
}
