package com.techStack.geoAccess.controller.admin;

import com.techStack.geoAccess.constants.GeoSecurityConstants;
import com.techStack.geoAccess.dto.response.ApiResponse;
import com.techStack.geoAccess.dto.response.GeoTestResponse;
import com.techStack.geoAccess.exception.data.ResourceNotFoundException;
import com.techStack.geoAccess.models.geo.GeoRecord;
import com.techStack.geoAccess.service.geo.GeoResolverService;
import com.techStack.geoAccess.service.policy.PolicyStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.security.Principal;
import java.time.Clock;
import java.util.List;

/**
 * Geo Lookup Controller
 *
 * Operator tools: test how an address resolves against the current policy, browse and purge
 * stored geolocation records.
 */
@Slf4j
@RestController
@RequestMapping("/api/admin/security/geo")
@RequiredArgsConstructor
@PreAuthorize("hasRole('ADMIN')")
public class GeoLookupController {

    private final GeoResolverService geoResolver;
    private final PolicyStore policyStore;
    private final Clock clock;

    @GetMapping
    public Mono<ApiResponse<GeoTestResponse>> test(@RequestParam String ip) {
        return policyStore.get().flatMap(policy -> geoResolver.resolve(ip)
                .map(geo -> GeoTestResponse.builder()
                        .ipAddress(ip)
                        .resolved(true)
                        .geo(geo)
                        .allowedByPolicy(policy.isCountryAllowed(geo.getCountryCode()))
                        .allowedCountries(policy.getAllowedCountries())
                        .build())
                .onErrorResume(e -> Mono.just(GeoTestResponse.builder()
                        .ipAddress(ip)
                        .resolved(false)
                        .allowedCountries(policy.getAllowedCountries())
                        .error(e.getMessage())
                        .build())))
                .map(result -> ApiResponse.success(result, clock.instant()));
    }

    @GetMapping("/records")
    public Mono<ApiResponse<List<GeoRecord>>> listRecords(
            @RequestParam(defaultValue = "" + GeoSecurityConstants.DEFAULT_LIST_LIMIT) int limit) {
        return geoResolver.listRecords(limit)
                .collectList()
                .map(records -> ApiResponse.success(records.size() + " record(s)", records, clock.instant()));
    }

    @DeleteMapping("/records/{ip}")
    public Mono<ApiResponse<Void>> purge(@PathVariable String ip, Principal principal) {
        log.info("Geo record purge for {} requested by {}", ip, principal.getName());
        return geoResolver.purge(ip)
                .flatMap(existed -> existed
                        ? Mono.just(ApiResponse.<Void>success("Geo record purged", null, clock.instant()))
                        : Mono.error(new ResourceNotFoundException("Geo record", ip)));
    }
}
