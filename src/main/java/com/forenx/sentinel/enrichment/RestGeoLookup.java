package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.GeoInfo;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Geo lookup against an HTTP endpoint answering {@code GET /{ip}} with
 * {@code {"country_code": "..", "country": ".."}}.
 *
 * Calls are bounded by a timeout and guarded by a circuit breaker that opens when half of the
 * last 10 calls failed, so an unreachable service costs one fast rejection per record instead
 * of a timeout. A 404 means the address is not known and maps to {@link GeoInfo#UNKNOWN};
 * other failures surface as {@link EnrichmentLookupException}.
 */
public class RestGeoLookup implements GeoLookup {

    private static final Logger log = LoggerFactory.getLogger(RestGeoLookup.class);

    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;
    private final Duration timeout;

    public RestGeoLookup(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;

        CircuitBreakerConfig cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .build();
        this.circuitBreaker = CircuitBreaker.of("geoLookup", cbConfig);
    }

    public RestGeoLookup(String baseUrl, Duration timeout) {
        this(WebClient.builder().baseUrl(baseUrl).build(), timeout);
    }

    @Override
    public GeoInfo lookup(String ip) {
        try {
            GeoInfo info = webClient.get()
                .uri("/{ip}", ip)
                .retrieve()
                .bodyToMono(GeoInfo.class)
                .timeout(timeout)
                .transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                .onErrorResume(this::isNotFound, e -> Mono.just(GeoInfo.UNKNOWN))
                .block();
            return info != null && info.getCountryCode() != null ? info : GeoInfo.UNKNOWN;
        } catch (CallNotPermittedException e) {
            throw new EnrichmentLookupException("geo", "geo lookup circuit open", e);
        } catch (RuntimeException e) {
            log.debug("Geo lookup for {} failed: {}", ip, e.getMessage());
            throw new EnrichmentLookupException("geo", "geo lookup failed for " + ip + ": " + e.getMessage(), e);
        }
    }

    CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    private boolean isNotFound(Throwable throwable) {
        return throwable instanceof WebClientResponseException
            && ((WebClientResponseException) throwable).getStatusCode().value() == 404;
    }
}
