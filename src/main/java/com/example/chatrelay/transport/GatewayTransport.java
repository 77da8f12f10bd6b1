package com.example.chatrelay.transport;

import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Pushes through an external WebSocket gateway that exposes
 * {@code POST /@connections/{connectionId}}. HTTP 410 means the connection is
 * gone.
 */
public class GatewayTransport implements Transport {

    private final RestClient restClient;

    public GatewayTransport(RestClient restClient) {
        this.restClient = restClient;
    }

    public static GatewayTransport create(String endpoint, int timeoutMs) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeoutMs);
        requestFactory.setReadTimeout(timeoutMs);
        return new GatewayTransport(RestClient.builder()
                .baseUrl(endpoint)
                .requestFactory(requestFactory)
                .build());
    }

    @Override
    public void push(String connectionId, byte[] payload) throws TransportException {
        try {
            restClient.post()
                    .uri("/@connections/{connectionId}", connectionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(payload)
                    .retrieve()
                    .toBodilessEntity();
        } catch (HttpClientErrorException.Gone e) {
            throw new TransportGoneException(connectionId, e);
        } catch (RestClientException e) {
            throw new TransportException(connectionId, "Gateway push to " + connectionId + " failed: " + e.getMessage(), e);
        }
    }
}
