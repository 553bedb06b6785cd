package io.github.jakubt4.vista.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;

import java.time.Duration;

/**
 * Timeouts for calls to the photo archive. Telemetry pages for wide sol ranges are large, so the
 * read timeout is longer than the connect timeout.
 */
@Configuration
public class RestClientConfig {

    @Bean
    RestClientCustomizer photoArchiveTimeouts(
            @Value("${photo-archive.connect-timeout:5s}") final Duration connectTimeout,
            @Value("${photo-archive.read-timeout:30s}") final Duration readTimeout) {
        return builder -> {
            final var requestFactory = new SimpleClientHttpRequestFactory();
            requestFactory.setConnectTimeout(connectTimeout);
            requestFactory.setReadTimeout(readTimeout);
            builder.requestFactory(requestFactory);
        };
    }
}
