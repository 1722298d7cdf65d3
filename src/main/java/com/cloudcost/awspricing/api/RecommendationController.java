package com.cloudcost.awspricing.api;

import com.cloudcost.awspricing.recommendation.RecommendationEngine;
import com.cloudcost.awspricing.recommendation.RecommendationEngine.RecommendationRequest;
import com.cloudcost.awspricing.recommendation.RecommendationEngine.RecommendationResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Batch SKU-upgrade recommendations.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Recommendations API", description = "Cheaper equivalent SKUs for EC2, EBS and RDS resources")
public class RecommendationController {

    private final RecommendationEngine recommendationEngine;

    @PostMapping("/recommendations")
    @Operation(summary = "Batch recommendations",
               description = "Generation upgrades, Graviton migrations and gp2 to gp3 volume changes for a batch of resources")
    public ResponseEntity<RecommendationResponse> getRecommendations(@RequestBody RecommendationRequest request) {
        int size = request.targetResources() == null ? 0 : request.targetResources().size();
        log.debug("Recommendations request: targetResources={}, filter={}", size, request.filter());
        return ResponseEntity.ok(recommendationEngine.getRecommendations(request));
    }
}
