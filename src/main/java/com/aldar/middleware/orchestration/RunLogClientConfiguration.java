package com.aldar.middleware.orchestration;

import com.aldar.middleware.config.OrchestrationProperties;
import com.aldar.middleware.transcript.source.RunLogProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

@Configuration(proxyBeanMethods = false)
public class RunLogClientConfiguration {

    private static final Logger log = LoggerFactory.getLogger(RunLogClientConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(RunLogProvider.class)
    public RunLogProvider runLogProvider(
            WebClient.Builder webClientBuilder,
            OrchestrationProperties properties,
            RunLogParser parser
    ) {
        WebClient.Builder builder = webClientBuilder.clone();
        if (StringUtils.hasText(properties.getBaseUrl())) {
            builder.baseUrl(properties.getBaseUrl().trim());
        } else {
            log.warn("orchestration.run-log.base-url is empty; transcripts will be built from the local ledger only");
        }
        Duration timeout = properties.getTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.clientConnector(new ReactorClientHttpConnector(HttpClient.create().responseTimeout(timeout)));
        }
        if (StringUtils.hasText(properties.getApiKey())) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey().trim());
        }
        if (properties.isLogRequests()) {
            builder.filter(logRequests());
        }
        return new OrchestrationRunLogClient(builder.build(), properties, parser);
    }

    private static ExchangeFilterFunction logRequests() {
        return (request, next) -> {
            log.info("run log request: {} {}, sent Authorization header: {}",
                    request.method(),
                    request.url(),
                    request.headers().containsKey(HttpHeaders.AUTHORIZATION));
            return next.exchange(request);
        };
    }
}
