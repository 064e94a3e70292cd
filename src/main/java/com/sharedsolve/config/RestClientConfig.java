package com.sharedsolve.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpRequest;
import org.springframework.http.client.BufferingClientHttpRequestFactory;
import org.springframework.http.client.ClientHttpRequestExecution;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Logs generator HTTP traffic on the {@code com.sharedsolve.http.logging} logger at DEBUG.
 */
@Configuration
public class RestClientConfig {

    static final String HTTP_LOGGER = "com.sharedsolve.http.logging";

    @Bean
    public RestClientCustomizer restClientCustomizer() {
        return restClientBuilder -> {
            restClientBuilder.requestInterceptor(new LoggingRequestInterceptor());
            // Buffered so the response body can be logged and still read by the caller
            restClientBuilder.requestFactory(new BufferingClientHttpRequestFactory(new SimpleClientHttpRequestFactory()));
        };
    }

    static class LoggingRequestInterceptor implements ClientHttpRequestInterceptor {
        private static final Logger httpLogger = LoggerFactory.getLogger(HTTP_LOGGER);

        @Override
        public ClientHttpResponse intercept(HttpRequest request, byte[] body, ClientHttpRequestExecution execution) throws IOException {
            // Local OpenAI-compatible servers reject placeholder bearer tokens
            HttpHeaders headers = request.getHeaders();
            String auth = headers.getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null) {
                String trimmed = auth.trim();
                if (trimmed.equalsIgnoreCase("Bearer none") || trimmed.equalsIgnoreCase("Bearer EMPTY")) {
                    headers.remove(HttpHeaders.AUTHORIZATION);
                }
            }

            if (!httpLogger.isDebugEnabled()) {
                return execution.execute(request, body);
            }
            logRequest(request, body);
            ClientHttpResponse response = execution.execute(request, body);
            logResponse(response);
            return response;
        }

        private void logRequest(HttpRequest request, byte[] body) {
            httpLogger.debug("--- HTTP Request ---");
            httpLogger.debug("URI: {} {}", request.getMethod(), request.getURI());
            httpLogger.debug("Headers: {}", masked(request.getHeaders()));
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        private void logResponse(ClientHttpResponse response) throws IOException {
            httpLogger.debug("--- HTTP Response ---");
            httpLogger.debug("Status: {}", response.getStatusCode());
            httpLogger.debug("Headers: {}", response.getHeaders());
            byte[] body = StreamUtils.copyToByteArray(response.getBody());
            if (body.length > 0) {
                httpLogger.debug("Body: {}", new String(body, StandardCharsets.UTF_8));
            }
        }

        static HttpHeaders masked(HttpHeaders headers) {
            HttpHeaders copy = new HttpHeaders();
            copy.putAll(headers);
            if (copy.containsKey(HttpHeaders.AUTHORIZATION)) {
                copy.set(HttpHeaders.AUTHORIZATION, "****");
            }
            return copy;
        }
    }
}
