// Copyright (c) Microsoft Corporation.
// Licensed under the MIT License.

package com.microsoft.azure.kusto.core.data;

import reactor.core.publisher.Mono;

/**
 * Supplies the value of the {@code Authorization} header, once per outgoing request.
 * An empty {@link Mono} sends the request without the header.
 */
@FunctionalInterface
public interface TokenProvider {
    Mono<String> getAuthorizationHeaderValueAsync();

    static TokenProvider anonymous() {
        return Mono::empty;
    }

    static TokenProvider bearer(String token) {
        Ensure.stringIsNotBlank(token, "token");
        return () -> Mono.just("Bearer " + token);
    }
}
