package io.agentmesh.client.http;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

/**
 * Minimal asynchronous HTTP client bound to one base URL.
 * <p>
 * Paths passed to {@link #get(String)} and {@link #post(String)} are resolved against the
 * base URL. Responses complete exceptionally only on transport failures or authentication
 * rejections (401/403); any other status is returned to the caller.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        /**
         * Sets a per-request timeout; the returned future fails with
         * {@link java.net.http.HttpTimeoutException} when it elapses.
         */
        T timeout(Duration timeout);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {
        PostRequestBuilder body(@Nullable String body);

        default PostRequestBuilder asJson() {
            return addHeader("Content-Type", "application/json");
        }

        default CompletableFuture<HttpResponse> send(String body) {
            return this.body(body).send();
        }
    }
}
