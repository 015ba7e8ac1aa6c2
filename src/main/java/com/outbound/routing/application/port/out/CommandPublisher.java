package com.outbound.routing.application.port.out;

import com.outbound.routing.domain.entity.RoutingCommand;

/**
 * Secondary (outbound) port: hands routing commands to the platform-adapter layer.
 * <p>
 * Same commandId must never result in duplicate sends. Called only after the
 * transition that produced the command has durably committed.
 * </p>
 */
public interface CommandPublisher {

    /**
     * @param command command to publish
     * @throws RuntimeException if the broker did not acknowledge the command
     */
    void publish(RoutingCommand command);
}
