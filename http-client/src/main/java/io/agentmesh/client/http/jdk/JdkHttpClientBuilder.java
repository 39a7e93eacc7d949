package io.agentmesh.client.http.jdk;

import io.agentmesh.client.http.HttpClient;
import io.agentmesh.client.http.HttpClientBuilder;

public class JdkHttpClientBuilder implements HttpClientBuilder {

    @Override
    public HttpClient create(String url) {
        return new JdkHttpClient(url);
    }
}
