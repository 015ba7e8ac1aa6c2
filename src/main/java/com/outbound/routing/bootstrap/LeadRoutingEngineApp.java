package com.outbound.routing.bootstrap;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Engagement-Based Lead Routing Engine - Application Entry Point.
 * <p>
 * Ingests engagement events per lead, keeps one scored aggregate per lead and
 * moves leads between outreach, hybrid and CRM platforms, emitting commands
 * for the platform adapters.
 * </p>
 *
 * <pre>
 * Architecture: Hexagonal (Ports &amp; Adapters)
 * Pattern:      Event-Driven (Apply-Score-Decide-Execute)
 * Tech:         Spring Boot 3.2 + Kafka + Redis + PostgreSQL
 * </pre>
 */
@SpringBootApplication(scanBasePackages = "com.outbound.routing")
@EnableScheduling
public class LeadRoutingEngineApp {

    public static void main(String[] args) {
        SpringApplication.run(LeadRoutingEngineApp.class, args);
    }
}
