package com.microsoft.azure.kusto.core.data.http;

import java.nio.ByteBuffer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

import com.azure.core.http.HttpHeaderName;
import com.azure.core.http.HttpHeaders;
import com.azure.core.http.HttpResponse;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class TestHttpResponse extends HttpResponse {

    private int fakeStatusCode;
    private String fakeBody;
    private final HttpHeaders fakeHeaders = new HttpHeaders();

    private TestHttpResponse() {
        super(null);
    }

    @Override
    public int getStatusCode() {
        return fakeStatusCode;
    }

    @Override
    public String getHeaderValue(String s) {
        return fakeHeaders.getValue(HttpHeaderName.fromString(s));
    }

    @Override
    public HttpHeaders getHeaders() {
        return fakeHeaders;
    }

    @Override
    public Flux<ByteBuffer> getBody() {
        return fakeBody == null ? Flux.empty() : Flux.just(ByteBuffer.wrap(fakeBody.getBytes(StandardCharsets.UTF_8)));
    }

    @Override
    public Mono<byte[]> getBodyAsByteArray() {
        return fakeBody == null ? Mono.empty() : Mono.just(fakeBody.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public Mono<String> getBodyAsString() {
        return Mono.justOrEmpty(fakeBody);
    }

    @Override
    public Mono<String> getBodyAsString(Charset charset) {
        return Mono.justOrEmpty(fakeBody);
    }

    public static TestHttpResponseBuilder newBuilder() {
        return new TestHttpResponseBuilder();
    }

    public static class TestHttpResponseBuilder {

        private final TestHttpResponse res = new TestHttpResponse();

        private TestHttpResponseBuilder() {
        }

        public TestHttpResponseBuilder withStatusCode(int statusCode) {
            res.fakeStatusCode = statusCode;
            return this;
        }

        public TestHttpResponseBuilder withBody(String body) {
            res.fakeBody = body;
            return this;
        }

        public TestHttpResponseBuilder addHeader(String name, String value) {
            res.fakeHeaders.add(HttpHeaderName.fromString(name), value);
            return this;
        }

        public TestHttpResponse build() {
            return res;
        }
    }
}
