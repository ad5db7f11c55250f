// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.ingest.resources;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import com.microsoft.azure.kusto.core.ingest.exceptions.IngestionClientException;
import com.microsoft.azure.kusto.core.ingest.exceptions.MalformedResourceUriException;

class ResourceURITest {
    private static final String QUEUE_URI = "https://account1.queue.core.windows.net/readyforaggregation-secured?sv=2018-03-28&sig=abc%2Fdef&se=2030";

    @Test
    void testParseQueue() {
        ResourceURI uri = ResourceURI.parse(QUEUE_URI);

        assertEquals("account1", uri.getStorageAccountName());
        assertEquals(StorageObjectType.QUEUE, uri.getObjectType());
        assertEquals("core.windows.net", uri.getStorageDomain());
        assertEquals("readyforaggregation-secured", uri.getObjectName());
        assertEquals("sv=2018-03-28&sig=abc%2Fdef&se=2030", uri.getSas());
    }

    @Test
    void testParseIsCaseInsensitiveAndKeepsOtherDomains() {
        ResourceURI uri = ResourceURI.parse("HTTPS://Account2.BLOB.Core.ChinaCloudApi.CN/20240101-ingestdata-e5c334ee145d4b4-0?sp=rw&sig=x");

        assertEquals("Account2", uri.getStorageAccountName());
        assertEquals(StorageObjectType.BLOB, uri.getObjectType());
        assertEquals("core.chinacloudapi.cn", uri.getStorageDomain());
        assertEquals("20240101-ingestdata-e5c334ee145d4b4-0", uri.getObjectName());
    }

    @ParameterizedTest
    @ValueSource(strings = {
            QUEUE_URI,
            "https://account3.blob.core.usgovcloudapi.net/container_1?sig=abc",
            "https://account4.table.core.windows.net/ingestionsstatus20240101?tn=ingestionsstatus&sig=x"
    })
    void testRoundTrip(String original) {
        ResourceURI parsed = ResourceURI.parse(original);

        assertEquals(parsed, ResourceURI.parse(parsed.toUri()));
        assertEquals(parsed.hashCode(), ResourceURI.parse(parsed.toUri()).hashCode());
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {
            "",
            "http://account.queue.core.windows.net/queue?sig=x",
            "https://account.file.core.windows.net/share?sig=x",
            "https://account.queue.core.windows.net/queue",
            "https://account.queue.core.windows.net/queue?",
            "https://account.queue.core.windows.net/?sig=x",
            "https://account.queue/queue?sig=x",
            "not a uri"
    })
    void testMalformedUrisAreRejected(String malformed) {
        MalformedResourceUriException e = assertThrows(MalformedResourceUriException.class, () -> ResourceURI.parse(malformed));
        assertEquals(malformed, e.getUri());
    }

    @Test
    void testConnectionStrings() {
        assertEquals("QueueEndpoint=https://account1.queue.core.windows.net/;SharedAccessSignature=sv=2018-03-28&sig=abc%2Fdef&se=2030",
                ResourceURI.parse(QUEUE_URI).toConnectionString());
        assertEquals("BlobEndpoint=https://account3.blob.core.windows.net/;SharedAccessSignature=sig=abc",
                ResourceURI.parse("https://account3.blob.core.windows.net/container?sig=abc").toConnectionString());
        assertThrows(IngestionClientException.class,
                () -> ResourceURI.parse("https://account4.table.core.windows.net/status?sig=x").toConnectionString());
    }

    @Test
    void testUriForms() {
        ResourceURI uri = ResourceURI.parse("https://account3.blob.core.windows.net/container?sig=abc");

        assertEquals("https://account3.blob.core.windows.net", uri.toUri(false, false));
        assertEquals("https://account3.blob.core.windows.net/container", uri.toUri(true, false));
        assertEquals("https://account3.blob.core.windows.net/container/db__table__id.csv?sig=abc", uri.toBlobUri("db__table__id.csv"));
        assertFalse(uri.toString().contains("sig="));
        assertThrows(IngestionClientException.class, () -> ResourceURI.parse(QUEUE_URI).toBlobUri("blob"));
    }
}
