package com.strollie.planner.web;

import com.strollie.planner.engine.resilience.ResultCache;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/cache")
@Tag(name = "Cache", description = "External call result cache maintenance")
public class CacheController {

    private final ResultCache resultCache;

    @GetMapping("/stats")
    @Operation(summary = "Entry count and hit rate")
    public ResultCache.CacheStats stats() {
        return resultCache.stats();
    }

    @DeleteMapping
    @Operation(summary = "Drop every cached result")
    public ResponseEntity<Void> clear() {
        resultCache.clear();
        return ResponseEntity.noContent().build();
    }
}
