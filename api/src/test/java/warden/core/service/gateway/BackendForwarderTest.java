package warden.core.service.gateway;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import warden.core.model.gateway.ForwardFailure;
import warden.core.model.gateway.ForwardResult;
import warden.core.model.gateway.GatewayRequest;
import warden.core.model.gateway.ProxyResponse;
import warden.core.port.out.BackendConnectionException;
import warden.core.port.out.ProxyClient;
import warden.core.service.admission.AdmissionController;
import warden.support.RecordingMetrics;

@DisplayName("BackendForwarder")
@ExtendWith(MockitoExtension.class)
class BackendForwarderTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration REQUEST_TIMEOUT = Duration.ofMillis(200);

    @Mock
    private ProxyClient proxyClient;

    private AdmissionController admissionController;
    private RecordingMetrics metrics;
    private BackendForwarder forwarder;

    @BeforeEach
    void setUp() {
        admissionController = new AdmissionController(2);
        metrics = new RecordingMetrics();
        forwarder = new BackendForwarder(
                new ProxyRequestPreparer(URI.create("http://backend:8001")),
                proxyClient,
                admissionController,
                metrics,
                REQUEST_TIMEOUT);
    }

    private GatewayRequest request() {
        return new GatewayRequest("GET", "/items", null, Map.of(), null, "10.0.0.1", "http");
    }

    private ForwardResult forward() {
        return forwarder.forward(request()).await().atMost(TIMEOUT);
    }

    @Nested
    @DisplayName("Successful forwarding")
    class SuccessTests {

        @Test
        @DisplayName("should return the backend response as-is")
        void shouldReturnBackendResponse() {
            final var response =
                    new ProxyResponse(418, Map.of("X-Backend", List.of("1")), "teapot".getBytes(), "text/plain");
            when(proxyClient.forward(any())).thenReturn(Uni.createFrom().item(response));

            final var result = assertInstanceOf(ForwardResult.Forwarded.class, forward());

            assertEquals(418, result.response().statusCode());
            assertEquals("text/plain", result.response().contentType());
            assertEquals(1, metrics.latencySamples());
            assertEquals(0, admissionController.inFlight());
        }
    }

    @Nested
    @DisplayName("Failure classification")
    class FailureTests {

        @Test
        @DisplayName("should classify connection failures as BACKEND_UNAVAILABLE")
        void shouldClassifyConnectionFailure() {
            when(proxyClient.forward(any()))
                    .thenReturn(Uni.createFrom()
                            .failure(new BackendConnectionException("refused", new IOException("refused"))));

            final var result = assertInstanceOf(ForwardResult.Failed.class, forward());

            assertEquals(ForwardFailure.BACKEND_UNAVAILABLE, result.failure());
        }

        @Test
        @DisplayName("should classify a slow backend as BACKEND_TIMEOUT")
        void shouldClassifyTimeout() {
            when(proxyClient.forward(any())).thenReturn(Uni.createFrom().nothing());

            final var result = assertInstanceOf(ForwardResult.Failed.class, forward());

            assertEquals(ForwardFailure.BACKEND_TIMEOUT, result.failure());
            assertEquals(0, admissionController.inFlight());
        }

        @Test
        @DisplayName("should classify unexpected errors as INTERNAL_ERROR")
        void shouldClassifyUnexpectedError() {
            when(proxyClient.forward(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("bug")));

            final var result = assertInstanceOf(ForwardResult.Failed.class, forward());

            assertEquals(ForwardFailure.INTERNAL_ERROR, result.failure());
        }

        @Test
        @DisplayName("should not leak slots after repeated failures")
        void shouldNotLeakSlots() {
            when(proxyClient.forward(any())).thenReturn(Uni.createFrom().failure(new IllegalStateException("bug")));

            for (int i = 0; i < 5; i++) {
                forward();
            }

            assertEquals(0, admissionController.inFlight());
            assertEquals(0, admissionController.waiting());
        }
    }
}
