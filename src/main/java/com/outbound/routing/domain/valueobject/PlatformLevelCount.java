package com.outbound.routing.domain.valueobject;

/**
 * Dashboard cell: leads on one platform at one engagement level.
 */
public record PlatformLevelCount(Platform platform, EngagementLevel level, long count, double averageScore) {
}
