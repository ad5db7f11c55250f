// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import java.lang.invoke.MethodHandles;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.http.HttpClient;
import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpRequest;
import com.azure.core.http.HttpResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.azure.kusto.core.data.exceptions.DataClientException;
import com.microsoft.azure.kusto.core.data.exceptions.DataServiceException;
import com.microsoft.azure.kusto.core.data.exceptions.KustoParseException;
import com.microsoft.azure.kusto.core.data.exceptions.KustoServiceQueryError;
import com.microsoft.azure.kusto.core.data.exceptions.OneApiError;
import com.microsoft.azure.kusto.core.data.exceptions.ThrottleException;
import com.microsoft.azure.kusto.core.data.http.HttpRequestBuilder;
import com.microsoft.azure.kusto.core.data.http.HttpStatus;

import reactor.core.publisher.Mono;

public class ClientImpl implements Client {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final String MGMT_ENDPOINT_VERSION = "v1";
    public static final String QUERY_ENDPOINT_VERSION = "v2";
    static final String CLIENT_REQUEST_ID_PREFIX = "KJC.execute";
    static final String ACTIVITY_ID_HEADER = "x-ms-activity-id";
    static final String DEFAULT_APPLICATION = "kusto-core-client";

    private final String clusterUrl;
    private final TokenProvider tokenProvider;
    private final HttpClient httpClient;
    private final String clientVersion;

    public ClientImpl(String clusterUrl, TokenProvider tokenProvider) {
        this(clusterUrl, tokenProvider, HttpClient.createDefault());
    }

    public ClientImpl(String clusterUrl, TokenProvider tokenProvider, HttpClient httpClient) {
        Ensure.stringIsNotBlank(clusterUrl, "clusterUrl");
        Ensure.argIsNotNull(tokenProvider, "tokenProvider");
        Ensure.argIsNotNull(httpClient, "httpClient");
        this.clusterUrl = StringUtils.removeEnd(clusterUrl.trim(), "/");
        this.tokenProvider = tokenProvider;
        this.httpClient = httpClient;
        this.clientVersion = "Kusto.Java.Core:" + Utils.getPackageVersion();
    }

    @Override
    public String getClusterUrl() {
        return clusterUrl;
    }

    @Override
    public KustoResponseDataSet executeQuery(String database, String query) throws DataServiceException, DataClientException {
        return executeQuery(database, query, null);
    }

    @Override
    public KustoResponseDataSet executeQuery(String database, String query, ClientRequestProperties properties)
            throws DataServiceException, DataClientException {
        return executeQueryAsync(database, query, properties).block();
    }

    @Override
    public Mono<KustoResponseDataSet> executeQueryAsync(String database, String query) {
        return executeQueryAsync(database, query, null);
    }

    @Override
    public Mono<KustoResponseDataSet> executeQueryAsync(String database, String query, ClientRequestProperties properties) {
        return executeAsync(database, query, properties, CommandType.QUERY);
    }

    @Override
    public KustoResponseDataSet executeMgmt(String database, String command) throws DataServiceException, DataClientException {
        return executeMgmt(database, command, null);
    }

    @Override
    public KustoResponseDataSet executeMgmt(String database, String command, ClientRequestProperties properties)
            throws DataServiceException, DataClientException {
        return executeMgmtAsync(database, command, properties).block();
    }

    @Override
    public Mono<KustoResponseDataSet> executeMgmtAsync(String database, String command) {
        return executeMgmtAsync(database, command, null);
    }

    @Override
    public Mono<KustoResponseDataSet> executeMgmtAsync(String database, String command, ClientRequestProperties properties) {
        return executeAsync(database, command, properties, CommandType.ADMIN_COMMAND);
    }

    private Mono<KustoResponseDataSet> executeAsync(String database, String command, ClientRequestProperties properties, CommandType commandType) {
        return Mono.defer(() -> {
            Ensure.stringIsNotBlank(database, "database");
            Ensure.stringIsNotBlank(command, "command");
            String url = String.format(commandType.getEndpoint(), clusterUrl);

            return tokenProvider.getAuthorizationHeaderValueAsync()
                    .map(Optional::of)
                    .defaultIfEmpty(Optional.empty())
                    .map(authorization -> HttpRequestBuilder.newPost(url)
                            .createCommandPayload(database, command, properties)
                            .withTracing(properties, CLIENT_REQUEST_ID_PREFIX, DEFAULT_APPLICATION, clientVersion)
                            .withAuthorization(authorization.orElse(null))
                            .build())
                    .flatMap(request -> postAsync(request, url))
                    .map(body -> parseResponse(body, url, commandType, properties));
        });
    }

    private Mono<String> postAsync(HttpRequest request, String url) {
        log.debug("Posting {} request to {}", request.getHttpMethod(), url);
        return httpClient.send(request)
                .flatMap(response -> Mono.using(
                        () -> response,
                        r -> processResponseBodyAsync(r, url),
                        HttpResponse::close))
                .onErrorMap(e -> !(e instanceof DataServiceException) && !(e instanceof DataClientException),
                        e -> new DataServiceException(url, "POST failed to send request: " + e.getMessage(), e instanceof Exception ? (Exception) e : null,
                                false));
    }

    Mono<String> processResponseBodyAsync(HttpResponse response, String url) {
        return response.getBodyAsString()
                .defaultIfEmpty("")
                .flatMap(responseBody -> {
                    switch (response.getStatusCode()) {
                        case HttpStatus.OK:
                            return Mono.just(responseBody);
                        case HttpStatus.TOO_MANY_REQS:
                            log.warn("Request to {} was throttled", url);
                            return Mono.error(new ThrottleException(url));
                        default:
                            return Mono.error(createExceptionFromResponse(url, response, responseBody));
                    }
                });
    }

    static DataServiceException createExceptionFromResponse(String url, HttpResponse httpResponse, String errorFromResponse) {
        String activityId = httpResponse.getHeaders().getValue(HttpHeaderName.fromString(ACTIVITY_ID_HEADER));
        String message = errorFromResponse;
        boolean isPermanent = false;
        if (StringUtils.isNotBlank(errorFromResponse)) {
            try {
                JsonNode jsonObject = Utils.getObjectMapper().readTree(errorFromResponse);
                if (jsonObject.has("error")) {
                    OneApiError apiError = OneApiError.fromJsonObject(jsonObject);
                    message = StringUtils.defaultIfBlank(apiError.getDescription(), apiError.getMessage());
                    isPermanent = apiError.isPermanent();
                } else if (jsonObject.has("message")) {
                    message = jsonObject.get("message").asText();
                }
            } catch (JsonProcessingException e) {
                // Not every error body is JSON, the raw text is kept as the message
                log.debug("Error response from {} is not JSON: {}", url, e.getMessage());
            }
        } else {
            message = String.format("Http StatusCode='%s'", httpResponse.getStatusCode());
        }

        return new DataServiceException(url, String.format("%s, ActivityId='%s'", message, StringUtils.defaultString(activityId)), null, isPermanent,
                httpResponse.getStatusCode());
    }

    private static KustoResponseDataSet parseResponse(String body, String url, CommandType commandType, ClientRequestProperties properties) {
        KustoResponseDataSet dataSet;
        try {
            dataSet = KustoResponseDataSet.fromJson(body, commandType.getProtocol());
        } catch (KustoParseException e) {
            throw new DataServiceException(url, "Failed to parse the response: " + e.getMessage(), e, true);
        }

        if (dataSet.getErrorsCount() > 0) {
            if (properties != null && properties.isDeferPartialQueryFailures()) {
                log.warn("Request to {} returned {} errors, returning partial results", url, dataSet.getErrorsCount());
            } else {
                throw KustoServiceQueryError.fromStatusTableExceptions(dataSet.getExceptions());
            }
        }
        return dataSet;
    }
}
