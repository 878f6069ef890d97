package com.solverhub.protocol;

import org.apache.hc.client5.http.classic.HttpClient;
import org.apache.hc.client5.http.classic.methods.HttpUriRequest;
import org.apache.hc.client5.http.impl.classic.HttpClientBuilder;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.io.SocketConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.HttpComponentsClientHttpRequestFactory;

import java.net.URI;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Apache HttpClient request factory that can abort the requests it created.
 * Aborting closes the connection of a request in flight; once aborted, the
 * factory aborts every request it creates afterwards.
 * Connections are not kept alive between requests.
 */
public class AbortableRequestFactory extends HttpComponentsClientHttpRequestFactory {

    private static final Logger log = LoggerFactory.getLogger(AbortableRequestFactory.class);

    private final Set<HttpUriRequest> requests = ConcurrentHashMap.newKeySet();
    private volatile boolean aborted;

    public AbortableRequestFactory(HttpClient httpClient) {
        super(httpClient);
    }

    /**
     * @param connectTimeoutMs Connect timeout
     * @param readTimeoutMs    Socket read timeout, 0 to wait as long as it takes
     */
    public static AbortableRequestFactory withTimeouts(int connectTimeoutMs, int readTimeoutMs) {
        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultSocketConfig(SocketConfig.custom()
                        .setSoTimeout(readTimeoutMs, TimeUnit.MILLISECONDS)
                        .build())
                .build();
        HttpClient httpClient = HttpClientBuilder.create()
                .setConnectionManager(connectionManager)
                .setConnectionReuseStrategy((request, response, context) -> false)
                .build();
        AbortableRequestFactory factory = new AbortableRequestFactory(httpClient);
        factory.setConnectTimeout(connectTimeoutMs);
        return factory;
    }

    @Override
    protected HttpUriRequest createHttpUriRequest(HttpMethod httpMethod, URI uri) {
        HttpUriRequest request = (HttpUriRequest) super.createHttpUriRequest(httpMethod, uri);
        requests.add(request);
        if (aborted) {
            request.abort();
        }
        return request;
    }

    /**
     * Abort every request created so far and all later ones.
     */
    public void abortAll() {
        aborted = true;
        for (HttpUriRequest request : requests) {
            log.debug("Aborting {} {}", request.getMethod(), request.getRequestUri());
            request.abort();
        }
    }

    public boolean isAborted() {
        return aborted;
    }

    /**
     * Drop the handles of finished requests.
     */
    void forgetRequests() {
        requests.clear();
    }
}
