// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest;

public class Commands {
    public static final String DEFAULT_DATABASE = "NetDefaultDB";
    public static final String INGESTION_RESOURCES_SHOW_COMMAND = ".get ingestion resources";
    public static final String IDENTITY_GET_COMMAND = ".get kusto identity token";

    public static final String RESOURCE_TYPE_NAME_COLUMN = "ResourceTypeName";
    public static final String STORAGE_ROOT_COLUMN = "StorageRoot";
    public static final String AUTHORIZATION_CONTEXT_COLUMN = "AuthorizationContext";

    private Commands() {
    }
}
