package com.outbound.routing.domain.valueobject;

/**
 * Outbound commands for the platform-adapter executors.
 * The routing engine never calls a vendor API itself.
 */
public enum CommandType {

    ENROLL_IN_CRM,

    REMOVE_FROM_OUTREACH,

    MARK_HYBRID
}
