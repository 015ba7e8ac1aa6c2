package com.outbound.routing.adapters.in.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.outbound.routing.application.service.CommandRelay;

/**
 * Redispatches commands of committed transitions that never reached the broker.
 */
@Component
@ConditionalOnProperty(prefix = "routing.relay", name = "enabled", havingValue = "true", matchIfMissing = true)
public class CommandRelayJob {

    private static final Logger log = LoggerFactory.getLogger(CommandRelayJob.class);

    private final CommandRelay commandRelay;

    public CommandRelayJob(CommandRelay commandRelay) {
        this.commandRelay = commandRelay;
    }

    @Scheduled(fixedDelayString = "${routing.relay.fixed-delay-ms:30000}")
    public void run() {
        try {
            int relayed = commandRelay.relayPending();
            if (relayed > 0) {
                log.info("action=command_relay_job_done relayed={}", relayed);
            }
        } catch (RuntimeException e) {
            log.error("action=command_relay_job_failed error={}", e.getMessage(), e);
        }
    }
}
