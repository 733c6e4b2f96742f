package com.panelgate.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * PanelGate application entry point.
 */
@SpringBootApplication(scanBasePackages = "com.panelgate")
public class PanelGateApplication {

    public static void main(String[] args) {
        SpringApplication.run(PanelGateApplication.class, args);
    }
}
