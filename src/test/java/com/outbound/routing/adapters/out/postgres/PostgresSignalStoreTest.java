package com.outbound.routing.adapters.out.postgres;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.adapters.out.postgres.PostgresSignalStore.SignalDocument;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.Platform;

class PostgresSignalStoreTest {

    private static final Instant OPENED_AT = Instant.parse("2026-03-01T09:30:00Z");
    private static final Instant ROUTED_AT = Instant.parse("2026-03-01T09:31:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private JdbcTemplate jdbcTemplate;
    private PostgresSignalStore store;

    @BeforeEach
    void setUp() {
        jdbcTemplate = mock(JdbcTemplate.class);
        store = new PostgresSignalStore(jdbcTemplate, objectMapper);
    }

    @Test
    void documentKeepsCountersScoreAndRoutingFields() throws Exception {
        EngagementSignal signal = openedAndRouted();

        String json = objectMapper.writeValueAsString(SignalDocument.fromDomain(signal));
        EngagementSignal loaded = objectMapper.readValue(json, SignalDocument.class)
                .toDomain("lead-1", "lead-1@example.com", 2L, signal.getCreatedAt(), signal.getUpdatedAt());

        assertThat(json).contains("\"emails_opened\":1").contains("\"current_platform\":\"outreach\"");
        assertThat(loaded.getEmailsOpened()).isEqualTo(1);
        assertThat(loaded.getRecentOpens()).containsExactly(OPENED_AT);
        assertThat(loaded.getEngagementScore()).isEqualTo(15.0);
        assertThat(loaded.getEngagementLevel()).isEqualTo(EngagementLevel.LUKEWARM);
        assertThat(loaded.getCurrentPlatform()).isEqualTo(Platform.OUTREACH);
        assertThat(loaded.getTransitionCount()).isEqualTo(1);
        assertThat(loaded.getLastRoutingDecision()).containsEntry("reason", "outreach_enrollment");
        assertThat(loaded.getVersion()).isEqualTo(2L);
    }

    @Test
    void firstWriteInsertsRow() {
        when(jdbcTemplate.update(startsWith("INSERT"), any(Object[].class))).thenReturn(1);

        assertThat(store.compareAndSet(openedAndRouted(), 0L)).isTrue();

        verify(jdbcTemplate, never()).update(startsWith("UPDATE"), any(Object[].class));
    }

    @Test
    void lostInsertRaceIsAConflict() {
        when(jdbcTemplate.update(startsWith("INSERT"), any(Object[].class))).thenReturn(0);

        assertThat(store.compareAndSet(openedAndRouted(), 0L)).isFalse();
    }

    @Test
    void staleVersionIsAConflict() {
        when(jdbcTemplate.update(startsWith("UPDATE"), any(Object[].class))).thenReturn(0);

        assertThat(store.compareAndSet(openedAndRouted(), 3L)).isFalse();

        verify(jdbcTemplate, never()).update(startsWith("INSERT"), any(Object[].class));
    }

    @Test
    void emailClaimedByAnotherLeadIsAConflict() {
        when(jdbcTemplate.update(startsWith("UPDATE"), any(Object[].class)))
                .thenThrow(new DuplicateKeyException("engagement_signals_email_key"));

        assertThat(store.compareAndSet(openedAndRouted(), 3L)).isFalse();
    }

    private static EngagementSignal openedAndRouted() {
        EngagementEvent open = new EngagementEvent("e-1", "lead-1", "lead-1@example.com", EventType.EMAIL_OPENED,
                EventSource.OUTREACH_PLATFORM, "instantly", "outreach_platform:evt-1", Map.of(), OPENED_AT, 1L);
        return EngagementSignal.initial("lead-1", "lead-1@example.com", OPENED_AT)
                .apply(open, OPENED_AT)
                .withScore(15.0, EngagementLevel.LUKEWARM)
                .withTransition(Platform.OUTREACH, Map.of("reason", "outreach_enrollment"), ROUTED_AT);
    }
}
