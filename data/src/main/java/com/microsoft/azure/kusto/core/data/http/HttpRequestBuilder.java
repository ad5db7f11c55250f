package com.microsoft.azure.kusto.core.data.http;

import java.lang.invoke.MethodHandles;
import java.net.MalformedURLException;
import java.net.URL;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import org.apache.commons.lang3.StringUtils;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpMethod;
import com.azure.core.http.HttpRequest;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.microsoft.azure.kusto.core.data.ClientRequestProperties;
import com.microsoft.azure.kusto.core.data.Utils;
import com.microsoft.azure.kusto.core.data.exceptions.DataClientException;

public class HttpRequestBuilder {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final String KUSTO_API_VERSION = "2019-02-13";
    private static final String LOCALHOST = "localhost";
    public static final String CLIENT_REQUEST_ID_HEADER = "x-ms-client-request-id";
    public static final String CLIENT_VERSION_HEADER = "x-ms-client-version";
    public static final String APP_HEADER = "x-ms-app";
    public static final String USER_HEADER = "x-ms-user";

    private final HttpRequest request;

    public static HttpRequestBuilder newPost(String url) {
        return new HttpRequestBuilder(HttpMethod.POST, url);
    }

    private HttpRequestBuilder(HttpMethod method, String url) {
        request = new HttpRequest(method, parseURLString(url));
    }

    public HttpRequestBuilder createCommandPayload(String database, String command, ClientRequestProperties properties) {
        ObjectNode json = Utils.getObjectMapper().createObjectNode()
                .put("db", database)
                .put("csl", command);

        if (properties != null) {
            json.put("properties", properties.toString());
        }

        request.setBody(json.toString());
        request.setHeader(HttpHeaderName.CONTENT_TYPE, "application/json; charset=utf-8");
        return this;
    }

    public HttpRequestBuilder withAuthorization(String value) {
        if (value != null) {
            request.setHeader(HttpHeaderName.AUTHORIZATION, value);
        }
        return this;
    }

    /**
     * Adds the correlation headers. Values from the request properties win over the client defaults.
     */
    public HttpRequestBuilder withTracing(ClientRequestProperties properties, String clientRequestIdPrefix, String defaultApplication, String clientVersion) {
        Map<String, String> headers = new HashMap<>();

        String clientRequestId = properties != null && StringUtils.isNotBlank(properties.getClientRequestId())
                ? properties.getClientRequestId()
                : String.format("%s;%s", clientRequestIdPrefix, UUID.randomUUID());
        headers.put(CLIENT_REQUEST_ID_HEADER, clientRequestId);

        String app = properties != null && properties.getApplication() != null ? properties.getApplication() : defaultApplication;
        if (StringUtils.isNotBlank(app)) {
            headers.put(APP_HEADER, app);
        }
        if (properties != null && StringUtils.isNotBlank(properties.getUser())) {
            headers.put(USER_HEADER, properties.getUser());
        }
        if (StringUtils.isNotBlank(clientVersion)) {
            headers.put(CLIENT_VERSION_HEADER, clientVersion);
        }

        // replace non-ascii characters in header values with '?'
        headers.replaceAll((name, v) -> v.replaceAll("[^\\x00-\\x7F]", "?"));
        headers.forEach((name, value) -> request.setHeader(HttpHeaderName.fromString(name), value));
        return this;
    }

    public HttpRequest build() {
        // If has authorization header, ensure it is not sent over insecure channel
        boolean hasAuth = request.getHeaders().get(HttpHeaderName.AUTHORIZATION) != null;
        if (hasAuth) {
            URL url = request.getUrl();
            boolean isHttp = url.getProtocol().equalsIgnoreCase("http");
            boolean isLocalhost = url.getHost().equalsIgnoreCase(LOCALHOST);

            if (isHttp) {
                if (isLocalhost) {
                    log.warn("Sending security token to localhost over an unencrypted channel (http://)");
                } else {
                    throw new DataClientException(url.toString(), "Cannot forward security token to a remote service over an unencrypted channel (http://)");
                }
            }
        }

        request.setHeader(HttpHeaderName.ACCEPT, "application/json");
        request.setHeader(HttpHeaderName.fromString("x-ms-version"), KUSTO_API_VERSION);
        return request;
    }

    @NotNull
    private static URL parseURLString(String url) {
        try {
            return new URL(url);
        } catch (MalformedURLException e) {
            throw new DataClientException(url, "Error parsing target URL in post request:" + e.getMessage(), e);
        }
    }
}
