package com.techStack.geoAccess.config.intergration;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the IP geolocation provider. Transport timeouts mirror the lookup timeout so a
 * hung connection cannot outlive the per-call bound.
 */
@Slf4j
@Configuration
public class GeoLookupClientConfig {

    @Bean
    public WebClient geoLookupWebClient(WebClient.Builder builder, GeoSecurityProperties properties) {
        Duration timeout = properties.getLookup().getTimeout();

        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) timeout.toMillis())
                .responseTimeout(timeout)
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)));

        log.info("Geo lookup client configured for {} with timeout {}",
                properties.getLookup().getUrl(), timeout);

        return builder
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .build();
    }
}
