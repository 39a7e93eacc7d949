package io.agentmesh.client.http.jdk;

import static java.net.HttpURLConnection.HTTP_FORBIDDEN;
import static java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;

import io.agentmesh.client.http.HttpClient;
import io.agentmesh.client.http.HttpResponse;
import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    static final String AUTHENTICATION_FAILED = "Authentication failed: Client credentials are missing or invalid";
    static final String AUTHORIZATION_FAILED = "Authorization failed: Client does not have permission for the operation";

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;

    JdkHttpClient(String baseUrl) {
        this.httpClient = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
        this.baseUrl = normalize(baseUrl);
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static String normalize(String uri) {
        URI parsed;
        try {
            parsed = URI.create(uri);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
        if (parsed.getScheme() == null || parsed.getAuthority() == null) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
        String path = parsed.getPath() == null ? "" : parsed.getPath();
        while (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        return parsed.getScheme() + "://" + parsed.getAuthority() + path;
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>();
        private @Nullable Duration timeout;

        JdkRequestBuilder(String path) {
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T timeout(Duration timeout) {
            this.timeout = timeout;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest.Builder createRequestBuilder() {
            String separator = path.startsWith("/") || path.isEmpty() ? "" : "/";
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + separator + path));
            if (timeout != null) {
                builder.timeout(timeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            return builder;
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        JdkGetRequestBuilder(String path) {
            super(path);
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder().GET().build();
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenCompose(RESPONSE_MAPPER);
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {
        private String body = "";

        JdkPostRequestBuilder(String path) {
            super(path);
        }

        @Override
        public PostRequestBuilder body(@Nullable String body) {
            this.body = body == null ? "" : body;
            return this;
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = super.createRequestBuilder()
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                    .build();
            return httpClient
                    .sendAsync(request, BodyHandlers.ofString(StandardCharsets.UTF_8))
                    .thenCompose(RESPONSE_MAPPER);
        }
    }

    private static final Function<java.net.http.HttpResponse<String>, CompletionStage<HttpResponse>> RESPONSE_MAPPER = response -> {
        if (response.statusCode() == HTTP_UNAUTHORIZED) {
            return CompletableFuture.failedStage(new IOException(AUTHENTICATION_FAILED));
        } else if (response.statusCode() == HTTP_FORBIDDEN) {
            return CompletableFuture.failedStage(new IOException(AUTHORIZATION_FAILED));
        }
        return CompletableFuture.completedFuture(new JdkHttpResponse(response.statusCode(), response.body()));
    };

    private record JdkHttpResponse(int statusCode, String body) implements HttpResponse {
    }
}
