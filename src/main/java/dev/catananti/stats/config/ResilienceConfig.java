package dev.catananti.stats.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralised resilience settings for calls to the remote stats API.
 * The stats layer never retries; a timeout or an open circuit surfaces as a transport failure.
 *
 * <pre>
 * return webClient.get()...
 *         .timeout(resilience.getExternalTimeout())
 *         .transformDeferred(CircuitBreakerOperator.of(resilience.statsCircuitBreaker()));
 * </pre>
 */
@Component
@Getter
@Slf4j
public class ResilienceConfig {

    private final Duration externalTimeout;
    private final float failureRateThreshold;
    private final Duration waitDurationInOpenState;
    private final int slidingWindowSize;

    public ResilienceConfig(
            @Value("${resilience.external.timeout-seconds:30}") int externalTimeoutSeconds,
            @Value("${resilience.circuit-breaker.failure-rate-threshold:50}") float failureRateThreshold,
            @Value("${resilience.circuit-breaker.wait-open-seconds:60}") int waitOpenSeconds,
            @Value("${resilience.circuit-breaker.sliding-window-size:10}") int slidingWindowSize
    ) {
        this.externalTimeout = Duration.ofSeconds(externalTimeoutSeconds);
        this.failureRateThreshold = failureRateThreshold;
        this.waitDurationInOpenState = Duration.ofSeconds(waitOpenSeconds);
        this.slidingWindowSize = slidingWindowSize;
        log.info("Resilience configuration initialized (timeout={}, failureRate={}%, window={}, waitOpen={})",
                externalTimeout, failureRateThreshold, slidingWindowSize, waitDurationInOpenState);
    }

    /**
     * Circuit breaker guarding the remote stats API.
     */
    public CircuitBreaker statsCircuitBreaker() {
        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(waitDurationInOpenState)
                .slidingWindowSize(slidingWindowSize)
                .minimumNumberOfCalls(slidingWindowSize)
                .build();
        return CircuitBreaker.of("stats-remote", cbConfig);
    }
}
