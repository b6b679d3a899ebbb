package com.aldar.middleware.security;

import com.aldar.middleware.config.AppAuthProperties;
import com.aldar.middleware.security.JwtPrincipalVerifier.JwtPrincipal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ApiJwtAuthWebFilterTest {

    private AppAuthProperties properties;
    private JwtPrincipalVerifier verifier;
    private ApiJwtAuthWebFilter filter;
    private final AtomicBoolean chained = new AtomicBoolean(false);
    private final WebFilterChain chain = exchange -> {
        chained.set(true);
        return Mono.empty();
    };

    @BeforeEach
    void setUp() {
        properties = new AppAuthProperties();
        verifier = mock(JwtPrincipalVerifier.class);
        filter = new ApiJwtAuthWebFilter(properties, verifier);
    }

    @Test
    void validBearerShouldExposePrincipal() {
        JwtPrincipal principal = new JwtPrincipal("user-7f3a", "issuer", Instant.parse("2030-01-01T00:00:00Z"));
        when(verifier.verify("good-token")).thenReturn(Optional.of(principal));
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .get("/api/chat/sessions/s-1/messages")
                .header(HttpHeaders.AUTHORIZATION, "Bearer good-token"));

        filter.filter(exchange, chain).block();

        assertThat(chained).isTrue();
        assertThat((Object) exchange.getAttribute(ApiJwtAuthWebFilter.JWT_PRINCIPAL_ATTR)).isEqualTo(principal);
    }

    @Test
    void missingOrInvalidBearerShouldReturnUnauthorized() {
        when(verifier.verify(any())).thenReturn(Optional.empty());
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .get("/api/chat/sessions/s-1/messages"));

        filter.filter(exchange, chain).block();

        assertThat(chained).isFalse();
        assertThat(exchange.getResponse().getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
        assertThat(exchange.getResponse().getBodyAsString().block()).contains("\"code\":401");
    }

    @Test
    void pathsOutsidePrefixShouldPassThrough() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/actuator/health"));

        filter.filter(exchange, chain).block();

        assertThat(chained).isTrue();
        verify(verifier, never()).verify(any());
    }

    @Test
    void disabledAuthShouldPassThrough() {
        properties.setEnabled(false);
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest
                .get("/api/chat/sessions/s-1/messages"));

        filter.filter(exchange, chain).block();

        assertThat(chained).isTrue();
        assertThat((Object) exchange.getAttribute(ApiJwtAuthWebFilter.JWT_PRINCIPAL_ATTR)).isNull();
    }
}
