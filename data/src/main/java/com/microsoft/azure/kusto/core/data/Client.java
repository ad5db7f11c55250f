// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import com.microsoft.azure.kusto.core.data.exceptions.DataClientException;
import com.microsoft.azure.kusto.core.data.exceptions.DataServiceException;

import reactor.core.publisher.Mono;

/**
 * A client for running queries and management commands against a Kusto endpoint.
 */
public interface Client {

    /**
     * Executes a query against the specified database. Queries use the V2 response protocol.
     *
     * @param database The name of the database.
     * @param query The query to execute.
     * @return The parsed response.
     * @throws DataServiceException If there is an error from the service.
     * @throws DataClientException If there is an error on the client side.
     */
    KustoResponseDataSet executeQuery(String database, String query) throws DataServiceException, DataClientException;

    KustoResponseDataSet executeQuery(String database, String query, ClientRequestProperties properties) throws DataServiceException, DataClientException;

    Mono<KustoResponseDataSet> executeQueryAsync(String database, String query);

    Mono<KustoResponseDataSet> executeQueryAsync(String database, String query, ClientRequestProperties properties);

    /**
     * Executes a management command against the specified database. Commands use the V1 response protocol.
     *
     * @param database The name of the database.
     * @param command The management command to execute.
     * @return The parsed response.
     * @throws DataServiceException If there is an error from the service.
     * @throws DataClientException If there is an error on the client side.
     */
    KustoResponseDataSet executeMgmt(String database, String command) throws DataServiceException, DataClientException;

    KustoResponseDataSet executeMgmt(String database, String command, ClientRequestProperties properties) throws DataServiceException, DataClientException;

    Mono<KustoResponseDataSet> executeMgmtAsync(String database, String command);

    Mono<KustoResponseDataSet> executeMgmtAsync(String database, String command, ClientRequestProperties properties);

    String getClusterUrl();
}
