package com.outbound.routing.application.port.in;

import com.outbound.routing.domain.entity.ExecutionResult;
import com.outbound.routing.domain.valueobject.Platform;

/**
 * Primary (inbound) port: operator-driven platform move.
 */
public interface OverridePlatformUseCase {

    /**
     * @param leadId    lead to move
     * @param target    destination platform (never none)
     * @param operator  who requested the move
     * @param note      free-text justification
     * @param requestId caller-supplied id; repeating it is a no-op
     */
    ExecutionResult override(String leadId, Platform target, String operator, String note, String requestId);
}
