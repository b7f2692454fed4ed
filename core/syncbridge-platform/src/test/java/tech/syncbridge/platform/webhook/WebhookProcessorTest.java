package tech.syncbridge.platform.webhook;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.syncbridge.platform.PlatformFixture;
import tech.syncbridge.platform.TestConfigs;
import tech.syncbridge.platform.integration.IntegrationInstance;
import tech.syncbridge.platform.integration.ProviderType;
import tech.syncbridge.platform.worker.WorkItem;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;

class WebhookProcessorTest {

    private PlatformFixture f;
    private SqliteWebhookEventRepository events;
    private WebhookHandlers handlers;
    private WebhookProcessor processor;
    private WebhookEventService eventService;
    private IntegrationInstance instance;

    @BeforeEach
    void setUp() {
        f = new PlatformFixture();
        events = new SqliteWebhookEventRepository(f.store, f.mapper);
        handlers = new WebhookHandlers(f.jobService, f.mappings);
        processor = new WebhookProcessor(events, handlers, f.ledger, f.metrics, TestConfigs.webhook(1));
        eventService = new WebhookEventService(events, f.pool);
        instance = f.activeInstance(null);
    }

    // ==================== Retries ====================

    @Test
    @DisplayName("A failing handler moves the event to FAILED, then DEAD_LETTERED once retries run out")
    void process_shouldDeadLetter_afterRetriesExhausted() {
        handlers.register(ProviderType.HUBSPOT, "deal.creation", event -> {
            throw new IllegalStateException("downstream unavailable");
        });
        WebhookEvent event = receivedEvent("deal.creation");

        assertThat(processor.process(event.id)).isEqualTo(WebhookStatus.FAILED);
        WebhookEvent failed = events.findById(event.id).orElseThrow();
        assertThat(failed.retryCount).isEqualTo(1);
        assertThat(failed.lastError).isEqualTo("downstream unavailable");
        assertThat(failed.nextAttemptAt).isAfter(Instant.now().plusSeconds(5));

        // not due yet
        assertThat(processor.process(event.id)).isEqualTo(WebhookStatus.FAILED);
        assertThat(events.findById(event.id).orElseThrow().retryCount).isEqualTo(1);

        forceDue(event.id);
        assertThat(processor.process(event.id)).isEqualTo(WebhookStatus.DEAD_LETTERED);
        assertThat(eventService.deadLetters(instance.id, 10)).extracting(e -> e.id).containsExactly(event.id);
        assertThat(f.ledger.find(event.id)).hasValueSatisfying(entry ->
            assertThat(entry.status()).isEqualTo("DEAD_LETTERED"));
    }

    @Test
    @DisplayName("Replay resets the retry budget and queues the event again")
    void replay_shouldResetAndResubmit_whenDeadLettered() {
        AtomicInteger calls = new AtomicInteger();
        handlers.register(ProviderType.HUBSPOT, "deal.creation", event -> {
            if (calls.incrementAndGet() <= 2) {
                throw new IllegalStateException("boom");
            }
        });
        WebhookEvent event = receivedEvent("deal.creation");
        processor.process(event.id);
        forceDue(event.id);
        assertThat(processor.process(event.id)).isEqualTo(WebhookStatus.DEAD_LETTERED);

        WebhookEvent replayed = eventService.replay(event.id);

        assertThat(replayed.status).isEqualTo(WebhookStatus.RECEIVED);
        assertThat(replayed.retryCount).isZero();
        verify(f.pool).submit(new WorkItem.WebhookWork(event.id, instance.id));
        assertThat(processor.process(event.id)).isEqualTo(WebhookStatus.PROCESSED);
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    @DisplayName("Replay refuses events that are not failed or dead-lettered")
    void replay_shouldThrow_whenEventProcessed() {
        WebhookEvent event = receivedEvent("deal.creation");
        processor.process(event.id);

        assertThatThrownBy(() -> eventService.replay(event.id)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Events for entity types without an inbound mapping are processed without a sync job")
    void process_shouldSkipJob_whenEntityTypeUnmapped() {
        WebhookEvent event = receivedEvent("deal.creation");

        assertThat(processor.process(event.id)).isEqualTo(WebhookStatus.PROCESSED);
        assertThat(f.jobs.findByInstance(instance.id, 10)).isEmpty();
    }

    @Test
    @DisplayName("A second event with an already processed payload is completed without running its handler again")
    void process_shouldSkipHandler_whenPayloadAlreadyProcessed() {
        AtomicInteger calls = new AtomicInteger();
        handlers.register(ProviderType.HUBSPOT, "deal.creation", event -> calls.incrementAndGet());
        WebhookEvent first = receivedEvent("deal.creation");
        WebhookEvent redelivered = receivedEvent("deal.creation", first.payloadHash);

        assertThat(processor.process(first.id)).isEqualTo(WebhookStatus.PROCESSED);
        assertThat(processor.process(redelivered.id)).isEqualTo(WebhookStatus.PROCESSED);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(f.ledger.isAlreadyProcessed("whk:" + instance.id + ":" + first.payloadHash)).isTrue();
    }

    // ==================== Backoff ====================

    @Test
    @DisplayName("Backoff doubles from the base delay and is capped")
    void backoff_shouldDoubleAndCap() {
        assertThat(processor.backoff(0)).isEqualTo(Duration.ofSeconds(10));
        assertThat(processor.backoff(3)).isEqualTo(Duration.ofSeconds(80));
        assertThat(processor.backoff(12)).isEqualTo(Duration.ofHours(1));
        assertThat(processor.backoff(60)).isEqualTo(Duration.ofHours(1));
    }

    private WebhookEvent receivedEvent(String eventType) {
        return receivedEvent(eventType, null);
    }

    private WebhookEvent receivedEvent(String eventType, String payloadHash) {
        Instant now = Instant.now();
        WebhookEvent event = new WebhookEvent();
        event.id = "whe_" + System.nanoTime();
        event.instanceId = instance.id;
        event.provider = ProviderType.HUBSPOT;
        event.eventType = eventType;
        event.entityType = "deal";
        event.entityRefs = List.of("42");
        event.payload = "[]";
        event.payloadHash = payloadHash != null ? payloadHash : event.id;
        event.signatureValid = true;
        event.status = WebhookStatus.RECEIVED;
        event.receivedAt = now;
        event.updatedAt = now;
        events.insert(event);
        return event;
    }

    private void forceDue(String eventId) {
        WebhookEvent event = events.findById(eventId).orElseThrow();
        event.nextAttemptAt = Instant.now().minusSeconds(1);
        events.update(event);
    }
}
