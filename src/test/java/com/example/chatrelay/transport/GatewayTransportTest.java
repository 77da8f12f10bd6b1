package com.example.chatrelay.transport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class GatewayTransportTest {

    private MockRestServiceServer server;
    private GatewayTransport transport;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("http://gateway.local");
        server = MockRestServiceServer.bindTo(builder).build();
        transport = new GatewayTransport(builder.build());
    }

    private static byte[] payload() {
        return "{\"id\":\"m1\"}".getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testPush_PostsPayloadToConnection() throws Exception {
        // Given
        server.expect(requestTo("http://gateway.local/@connections/A"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(content().string("{\"id\":\"m1\"}"))
                .andRespond(withSuccess());

        // When
        transport.push("A", payload());

        // Then
        server.verify();
    }

    @Test
    void testPush_GoneStatusMeansConnectionGone() {
        // Given
        server.expect(requestTo("http://gateway.local/@connections/A"))
                .andRespond(withStatus(HttpStatus.GONE));

        // When / Then
        assertThrows(TransportGoneException.class, () -> transport.push("A", payload()));
    }

    @Test
    void testPush_ServerErrorIsOrdinaryFailure() {
        // Given
        server.expect(requestTo("http://gateway.local/@connections/A"))
                .andRespond(withStatus(HttpStatus.INTERNAL_SERVER_ERROR));

        // When
        TransportException e = assertThrows(TransportException.class, () -> transport.push("A", payload()));

        // Then
        assertFalse(e instanceof TransportGoneException);
    }
}
