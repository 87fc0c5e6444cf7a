package com.aegis.data.http;

import com.aegis.config.Config;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Thin GET wrapper over {@link HttpClient} with a fixed user agent and timeouts.
 */
public class HttpClientEx {
    private final HttpClient client;
    private final Duration requestTimeout;
    private final String userAgent;

    public HttpClientEx(Config config) {
        this(config.getSeconds("http.connect_timeout_sec", 10),
                config.getSeconds("http.request_timeout_sec", 15),
                config.getString("http.user_agent", "aegis-signal-core/1.0"));
    }

    public HttpClientEx(Duration connectTimeout, Duration requestTimeout, String userAgent) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.requestTimeout = requestTimeout;
        this.userAgent = userAgent;
    }

    /**
     * Returns the response body of a 2xx GET.
     *
     * @throws IOException on transport failure or a non-2xx status
     */
    public String getText(String url) throws IOException {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(requestTimeout)
                .header("User-Agent", userAgent)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> resp;
        try {
            resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while fetching " + url, e);
        }
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new IOException("HTTP " + resp.statusCode() + " for " + url);
    }
}
