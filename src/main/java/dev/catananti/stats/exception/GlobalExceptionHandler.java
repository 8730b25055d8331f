package dev.catananti.stats.exception;

import dev.catananti.stats.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(FeatureGatedException.class)
    @ResponseStatus(HttpStatus.PAYMENT_REQUIRED)
    public Mono<ErrorResponse> handleFeatureGated(FeatureGatedException ex, ServerWebExchange exchange) {
        log.info("Feature gated for {}: {}", ex.getItem(), ex.getMessage());
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.PAYMENT_REQUIRED.value())
                .error("Upgrade required")
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().value())
                .item(ex.getItem())
                .build());
    }

    @ExceptionHandler(UnsupportedCombinationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleUnsupportedCombination(UnsupportedCombinationException ex,
                                                            ServerWebExchange exchange) {
        log.warn("Unsupported top list request: {}", ex.getMessage());
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Bad Request")
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().value())
                .item(ex.getItem())
                .build());
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        log.warn("Invalid request: {}", ex.getMessage());
        String message = ex instanceof ServerWebInputException input && input.getReason() != null
                ? input.getReason()
                : ex.getMessage();
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.BAD_REQUEST.value())
                .error("Bad Request")
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build());
    }

    @ExceptionHandler(StatsRemoteException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleRemote(StatsRemoteException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.is(StatsRemoteException.Kind.AUTHORIZATION) ? HttpStatus.FORBIDDEN : HttpStatus.BAD_GATEWAY;
        log.error("Stats API failure ({}): {}", ex.getKind(), ex.getMessage());
        return Mono.just(ResponseEntity.status(status).body(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(ex.getMessage())
                .path(exchange.getRequest().getPath().value())
                .build()));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error: ", ex);
        return Mono.just(ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .error("Internal Server Error")
                .message("An unexpected error occurred")
                .path(exchange.getRequest().getPath().value())
                .build());
    }
}
