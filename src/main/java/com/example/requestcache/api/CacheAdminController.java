package com.example.requestcache.api;

import com.example.requestcache.config.CacheProperties;
import com.example.requestcache.core.CacheStats;
import com.example.requestcache.core.CacheStore;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/cache")
@RequiredArgsConstructor
public class CacheAdminController {

    private final CacheStore cacheStore;
    private final CacheProperties properties;

    @GetMapping("/stats")
    public CacheStats stats() {
        return cacheStore.getStats();
    }

    // non-production only, see request-cache.admin.clear-enabled
    @PostMapping("/clear")
    public ResponseEntity<Map<String, Object>> clear() {
        if (!properties.getAdmin().isClearEnabled()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                .body(Map.of("error", "Cache clear is disabled"));
        }
        int cleared = cacheStore.size();
        cacheStore.clear();
        log.info("Cache cleared through admin endpoint: entries={}", cleared);
        return ResponseEntity.ok(Map.of("cleared", cleared));
    }
}
