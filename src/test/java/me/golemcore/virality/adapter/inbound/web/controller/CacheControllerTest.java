package me.golemcore.virality.adapter.inbound.web.controller;

import me.golemcore.virality.cache.InMemoryCacheStore;
import me.golemcore.virality.domain.model.CacheEntrySummary;
import me.golemcore.virality.domain.model.CacheStats;
import me.golemcore.virality.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CacheControllerTest {

    private MutableClock clock;
    private InMemoryCacheStore<Object> store;
    private CacheController controller;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(1_000_000L);
        store = new InMemoryCacheStore<>(clock, Duration.ZERO);
        controller = new CacheController(store);
    }

    @Test
    void shouldReturnStats() {
        store.set("tweet-analysis-abc", "report", Duration.ofMinutes(30));
        store.get("tweet-analysis-abc");
        store.get("tweet-analysis-missing");

        StepVerifier.create(controller.getStats())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    CacheStats stats = response.getBody();
                    assertNotNull(stats);
                    assertEquals(1, stats.getTotalEntries());
                    assertEquals(1, stats.getTotalHits());
                    assertEquals(1, stats.getTotalMisses());
                    assertEquals(0.5, stats.getHitRate(), 1e-9);
                })
                .verifyComplete();
    }

    @Test
    void shouldListEntries() {
        store.set("trending-topics-US", "topics", Duration.ofMinutes(5));
        clock.advanceMillis(1500);

        StepVerifier.create(controller.getEntries())
                .assertNext(response -> {
                    List<CacheEntrySummary> entries = response.getBody();
                    assertNotNull(entries);
                    assertEquals(1, entries.size());
                    assertEquals("trending-topics-US", entries.get(0).key());
                    assertEquals(1500, entries.get(0).ageMs());
                    assertEquals(Duration.ofMinutes(5).toMillis(), entries.get(0).ttlMs());
                })
                .verifyComplete();
    }

    @Test
    void shouldDeleteExistingEntry() {
        store.set("ab-test-xyz-3", "result", Duration.ofMinutes(10));

        StepVerifier.create(controller.deleteEntry("ab-test-xyz-3"))
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        assertFalse(store.has("ab-test-xyz-3"));
    }

    @Test
    void shouldReturnNotFoundForUnknownEntry() {
        StepVerifier.create(controller.deleteEntry("missing"))
                .assertNext(response -> assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode()))
                .verifyComplete();
    }

    @Test
    void shouldClearAllEntries() {
        store.set("a", 1, Duration.ofMinutes(1));
        store.set("b", 2, Duration.ofMinutes(1));

        StepVerifier.create(controller.clear())
                .assertNext(response -> assertEquals(HttpStatus.NO_CONTENT, response.getStatusCode()))
                .verifyComplete();
        assertEquals(0, store.getStats().getTotalEntries());
    }

    @Test
    void shouldClearOnlyExpiredEntries() {
        store.set("short", 1, Duration.ofSeconds(1));
        store.set("long", 2, Duration.ofMinutes(10));
        clock.advance(Duration.ofSeconds(2));

        StepVerifier.create(controller.clearExpired())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(1, response.getBody().cleared());
                })
                .verifyComplete();
        assertTrue(store.has("long"));
    }
}
