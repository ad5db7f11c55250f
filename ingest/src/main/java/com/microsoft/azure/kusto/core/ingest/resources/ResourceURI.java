// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.resources;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.exceptions.MalformedResourceUriException;

/**
 * A storage queue, blob container or table as handed out by {@code .get ingestion resources}: the account, the
 * object and the SAS token that grants access to it.
 */
public class ResourceURI {
    private static final Pattern URI_FORMAT = Pattern.compile(
            "https://(\\w+)\\.(queue|blob|table)\\.((?:[a-z0-9-]+\\.)*[a-z0-9-]+)/([\\w,-]+)\\?(.+)",
            Pattern.CASE_INSENSITIVE);

    private final String storageAccountName;
    private final StorageObjectType objectType;
    private final String storageDomain;
    private final String objectName;
    private final String sas;

    public ResourceURI(String storageAccountName, StorageObjectType objectType, String storageDomain, String objectName, String sas) {
        this.storageAccountName = storageAccountName;
        this.objectType = objectType;
        this.storageDomain = storageDomain;
        this.objectName = objectName;
        this.sas = sas;
    }

    /**
     * @param uri a locator shaped {@code https://{account}.{queue|blob|table}.{storage-domain}/{objectName}?{sas}}
     * @return the parsed resource
     * @throws MalformedResourceUriException if the locator does not have that shape
     */
    public static ResourceURI parse(String uri) throws MalformedResourceUriException {
        if (uri == null) {
            throw new MalformedResourceUriException(null);
        }
        Matcher matcher = URI_FORMAT.matcher(uri.trim());
        if (!matcher.matches()) {
            throw new MalformedResourceUriException(uri);
        }
        return new ResourceURI(
                matcher.group(1),
                StorageObjectType.fromName(matcher.group(2)),
                matcher.group(3).toLowerCase(Locale.ROOT),
                matcher.group(4),
                matcher.group(5));
    }

    public String getStorageAccountName() {
        return storageAccountName;
    }

    public StorageObjectType getObjectType() {
        return objectType;
    }

    public String getStorageDomain() {
        return storageDomain;
    }

    public String getObjectName() {
        return objectName;
    }

    public String getSas() {
        return sas;
    }

    public String getAccountEndpoint() {
        return String.format("https://%s.%s.%s", storageAccountName, objectType.getName(), storageDomain);
    }

    public String toUri() {
        return toUri(true, true);
    }

    public String toUri(boolean withObjectName, boolean withSas) {
        StringBuilder builder = new StringBuilder(getAccountEndpoint());
        if (withObjectName) {
            builder.append('/').append(objectName);
        }
        if (withSas) {
            builder.append('?').append(sas);
        }
        return builder.toString();
    }

    /**
     * @return the URI of a blob inside this container, carrying the container's SAS token
     * @throws IngestionClientException if this resource is not a blob container
     */
    public String toBlobUri(String blobName) throws IngestionClientException {
        if (objectType != StorageObjectType.BLOB) {
            throw new IngestionClientException(String.format("'%s' is not a blob container", this));
        }
        return String.format("%s/%s/%s?%s", getAccountEndpoint(), objectName, blobName, sas);
    }

    /**
     * Builds the storage SDK connection string for this resource. Only queues and blob containers have one.
     *
     * @throws IngestionClientException for table resources
     */
    public String toConnectionString() throws IngestionClientException {
        if (objectType == StorageObjectType.TABLE) {
            throw new IngestionClientException(
                    String.format("Can't make the current object type (%s) to connection string", objectType.getName()));
        }
        return String.format("%s=%s/;SharedAccessSignature=%s", objectType.getEndpointKey(), getAccountEndpoint(), sas);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ResourceURI that = (ResourceURI) o;
        return storageAccountName.equals(that.storageAccountName)
                && objectType == that.objectType
                && storageDomain.equals(that.storageDomain)
                && objectName.equals(that.objectName)
                && sas.equals(that.sas);
    }

    @Override
    public int hashCode() {
        return Objects.hash(storageAccountName, objectType, storageDomain, objectName, sas);
    }

    @Override
    public String toString() {
        return toUri(true, false);
    }
}
