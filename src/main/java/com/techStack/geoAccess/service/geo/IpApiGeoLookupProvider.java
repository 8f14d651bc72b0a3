package com.techStack.geoAccess.service.geo;

import com.techStack.geoAccess.config.GeoSecurityProperties;
import com.techStack.geoAccess.dto.internal.GeoLookupResult;
import com.techStack.geoAccess.exception.service.LookupUnavailableException;
import com.techStack.geoAccess.repository.geo.GeoLookupProvider;
import com.techStack.geoAccess.repository.metrics.MetricsService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * ip-api.com JSON endpoint. The free tier reports a single {@code proxy} flag covering proxies,
 * VPNs and Tor exits, so {@code vpn} and {@code tor} are always false here.
 */
@Slf4j
@Service
public class IpApiGeoLookupProvider implements GeoLookupProvider {

    private static final String FIELDS =
            "status,message,country,countryCode,regionName,city,isp,org,lat,lon,proxy,hosting";

    private final WebClient webClient;
    private final GeoSecurityProperties properties;
    private final MetricsService metricsService;

    public IpApiGeoLookupProvider(@Qualifier("geoLookupWebClient") WebClient webClient,
                                  GeoSecurityProperties properties,
                                  MetricsService metricsService) {
        this.webClient = webClient;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    @Override
    public Mono<GeoLookupResult> lookup(String ipAddress) {
        Duration timeout = properties.getLookup().getTimeout();
        long started = System.nanoTime();

        return webClient.get()
                .uri(properties.getLookup().getUrl() + "/{ip}?fields={fields}", ipAddress, FIELDS)
                .retrieve()
                .bodyToMono(IpApiResponse.class)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(new LookupUnavailableException("Empty geolocation response")))
                .map(response -> toResult(ipAddress, response))
                .doOnSuccess(result -> metricsService.recordTimer("geo.lookup.duration",
                        Duration.ofNanos(System.nanoTime() - started), "outcome", "success"))
                .onErrorMap(e -> !(e instanceof LookupUnavailableException), e -> {
                    String reason = e instanceof TimeoutException ? "timed out after " + timeout : e.getMessage();
                    return new LookupUnavailableException("Geolocation lookup " + reason, e);
                })
                .doOnError(e -> {
                    metricsService.incrementCounter("geo.lookup.failures");
                    log.warn("Geo lookup failed for {}: {}", ipAddress, e.getMessage());
                });
    }

    private GeoLookupResult toResult(String ipAddress, IpApiResponse response) {
        if (!"success".equalsIgnoreCase(response.getStatus()) || response.getCountryCode() == null) {
            throw new LookupUnavailableException(
                    "Provider could not resolve " + ipAddress + ": " + response.getMessage());
        }
        return GeoLookupResult.builder()
                .countryCode(response.getCountryCode().toUpperCase())
                .countryName(response.getCountry())
                .region(response.getRegionName())
                .city(response.getCity())
                .isp(response.getIsp())
                .organization(response.getOrg())
                .latitude(response.getLat())
                .longitude(response.getLon())
                .proxy(response.isProxy())
                .vpn(false)
                .tor(false)
                .hosting(response.isHosting())
                .build();
    }

    @Data
    static class IpApiResponse {
        private String status;
        private String message;
        private String country;
        private String countryCode;
        private String regionName;
        private String city;
        private String isp;
        private String org;
        private Double lat;
        private Double lon;
        private boolean proxy;
        private boolean hosting;
    }
}
