package com.priceradar.api.controller;

import com.priceradar.aggregation.PriceAggregationService;
import com.priceradar.aggregation.ProviderStatus;
import com.priceradar.api.dto.ApiKeyUpdateRequest;
import com.priceradar.api.dto.ErrorBody;
import com.priceradar.api.dto.PriorityUpdateRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Provider administration: status probe, fallback priority, API keys, removal.
 */
@RestController
@RequestMapping("/api/v1/sources")
@RequiredArgsConstructor
public class SourceController {

    private final PriceAggregationService aggregationService;

    @GetMapping("/status")
    public Mono<Map<String, ProviderStatus>> status() {
        return Mono.fromCallable(aggregationService::checkApiStatus)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/priority")
    public List<String> priority() {
        return aggregationService.getApiPriority();
    }

    @PutMapping("/priority")
    public ResponseEntity<?> updatePriority(@RequestBody @Valid PriorityUpdateRequest request) {
        if (!aggregationService.updateApiPriority(request.priority())) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_PRIORITY", "priority must list at least one provider"));
        }
        return ResponseEntity.ok(aggregationService.getApiPriority());
    }

    @PutMapping("/{name}/api-key")
    public ResponseEntity<Void> updateApiKey(@PathVariable String name, @RequestBody @Valid ApiKeyUpdateRequest request) {
        aggregationService.updateApiKey(name, request.apiKey().strip());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{name}")
    public ResponseEntity<?> remove(@PathVariable String name) {
        if (!aggregationService.removeApiSource(name)) {
            return ResponseEntity.status(404).body(ErrorBody.of("UNKNOWN_SOURCE", "No source registered as " + name));
        }
        return ResponseEntity.noContent().build();
    }
}
