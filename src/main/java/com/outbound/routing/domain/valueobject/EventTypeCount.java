package com.outbound.routing.domain.valueobject;

public record EventTypeCount(String eventType, long count) {
}
