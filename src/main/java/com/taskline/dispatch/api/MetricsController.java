package com.taskline.dispatch.api;

import com.taskline.core.security.AuthFilter;
import com.taskline.core.trust.MetricsSnapshot;
import com.taskline.core.trust.TrustMetricsService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for trust calibration metrics.
 */
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private final TrustMetricsService trustMetricsService;

    public MetricsController(TrustMetricsService trustMetricsService) {
        this.trustMetricsService = trustMetricsService;
    }

    /**
     * GET /api/v1/metrics — {@code {aggregate, byAgent, timestamp}} for the caller's tasks.
     */
    @GetMapping
    public MetricsSnapshot metrics(@RequestAttribute(name = AuthFilter.USER_ATTRIBUTE, required = false) String userId) {
        return trustMetricsService.snapshot(CurrentUser.require(userId));
    }
}
