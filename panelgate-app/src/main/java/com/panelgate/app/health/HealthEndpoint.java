package com.panelgate.app.health;

import com.panelgate.gateway.runtime.HealthMonitor;
import com.panelgate.gateway.runtime.HealthReport;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Resource health probe. Always 200; problems are reported as warnings in the body.
 */
@RestController
public class HealthEndpoint {

    private final HealthMonitor healthMonitor;

    public HealthEndpoint(HealthMonitor healthMonitor) {
        this.healthMonitor = healthMonitor;
    }

    @GetMapping("/health")
    public HealthReport health() {
        return healthMonitor.report();
    }
}
