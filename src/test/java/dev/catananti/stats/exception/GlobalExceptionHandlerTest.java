package dev.catananti.stats.exception;

import dev.catananti.stats.entity.SiteMetric;
import dev.catananti.stats.entity.TopListItemType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.RequestPath;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    @Mock
    private ServerWebExchange exchange;

    @Mock
    private ServerHttpRequest request;

    @Mock
    private RequestPath requestPath;

    @InjectMocks
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        lenient().when(exchange.getRequest()).thenReturn(request);
        lenient().when(request.getPath()).thenReturn(requestPath);
        lenient().when(requestPath.value()).thenReturn("/api/v1/stats/top/VIDEOS");
    }

    // ──────────────────────────────────────────────
    // handleFeatureGated
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("handleFeatureGated()")
    class HandleFeatureGated {

        @Test
        @DisplayName("should return 402 naming the gated category")
        void shouldReturn402() {
            var ex = new FeatureGatedException(TopListItemType.VIDEOS, "Upgrade to see video plays", null);

            StepVerifier.create(handler.handleFeatureGated(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(HttpStatus.PAYMENT_REQUIRED.value());
                        assertThat(resp.getItem()).isEqualTo(TopListItemType.VIDEOS);
                        assertThat(resp.getPath()).isEqualTo("/api/v1/stats/top/VIDEOS");
                    })
                    .verifyComplete();
        }
    }

    // ──────────────────────────────────────────────
    // handleUnsupportedCombination / handleBadRequest
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("Bad requests")
    class BadRequests {

        @Test
        @DisplayName("should return 400 for a metric the category does not support")
        void unsupportedCombination() {
            var ex = new UnsupportedCombinationException(TopListItemType.FILE_DOWNLOADS, SiteMetric.VIEWS);

            StepVerifier.create(handler.handleUnsupportedCombination(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getItem()).isEqualTo(TopListItemType.FILE_DOWNLOADS);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 400 with the input reason")
        void invalidInput() {
            var ex = new ServerWebInputException("Type mismatch for granularity");

            StepVerifier.create(handler.handleBadRequest(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(400);
                        assertThat(resp.getMessage()).isEqualTo("Type mismatch for granularity");
                        assertThat(resp.getItem()).isNull();
                    })
                    .verifyComplete();
        }
    }

    // ──────────────────────────────────────────────
    // handleRemote
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("handleRemote()")
    class HandleRemote {

        @Test
        @DisplayName("should return 403 for an authorization failure")
        void authorization() {
            var ex = new StatsRemoteException(StatsRemoteException.Kind.AUTHORIZATION, 403, "unauthorized", "Denied");

            StepVerifier.create(handler.handleRemote(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatusCode().value()).isEqualTo(403);
                        assertThat(resp.getBody()).isNotNull();
                        assertThat(resp.getBody().getMessage()).isEqualTo("Denied");
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should return 502 for a transport failure")
        void transport() {
            var ex = new StatsRemoteException(StatsRemoteException.Kind.TRANSPORT, "Stats API request timed out", null);

            StepVerifier.create(handler.handleRemote(ex, exchange))
                    .assertNext(resp -> assertThat(resp.getStatusCode().value()).isEqualTo(502))
                    .verifyComplete();
        }
    }

    // ──────────────────────────────────────────────
    // handleGenericException
    // ──────────────────────────────────────────────
    @Nested
    @DisplayName("handleGenericException()")
    class HandleGenericException {

        @Test
        @DisplayName("should return 500 without exposing internal details")
        void shouldReturn500() {
            var ex = new IllegalStateException("cache store corrupted at key 42");

            StepVerifier.create(handler.handleGenericException(ex, exchange))
                    .assertNext(resp -> {
                        assertThat(resp.getStatus()).isEqualTo(500);
                        assertThat(resp.getMessage()).doesNotContain("42");
                    })
                    .verifyComplete();
        }
    }
}
