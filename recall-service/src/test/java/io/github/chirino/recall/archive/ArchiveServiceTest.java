package io.github.chirino.recall.archive;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.spy;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.config.TestSelectors;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.MessageRole;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.service.ChatRegistry;
import io.github.chirino.recall.store.impl.InMemoryChatStore;
import io.github.chirino.recall.window.MessageRenderer;
import io.github.chirino.recall.window.TestWindow;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ArchiveServiceTest {

    private static final long CHAT = 7L;
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ChatStoreSelector stores;
    private MemorySettings settings;
    private MessageRenderer renderer;
    private ScriptedSummarizer summarizer;
    private ChatRegistry registry;
    private ArchiveService service;

    @BeforeEach
    void setUp() {
        stores = TestSelectors.inMemoryStore();
        settings = TestSelectors.settings(stores);
        renderer = TestWindow.renderer();
        summarizer = new ScriptedSummarizer();
        registry = new ChatRegistry();

        service = new ArchiveService();
        service.storeSelector = stores;
        service.windowSelector = TestWindow.selector(stores);
        service.renderer = renderer;
        service.settings = settings;
        service.registry = registry;
        service.summarizer = summarizer;
        service.meterRegistry = new SimpleMeterRegistry();
        service.debounce = Duration.ZERO;
        service.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void threshold_fires_before_idle_and_folds_the_whole_buffer() {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");

        ArchiveOutcome outcome = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.COMPACTED, outcome.status());
        assertEquals(TriggerReason.THRESHOLD, outcome.reason());
        assertEquals(messages.get(7).id(), outcome.lastFoldedId());
        assertEquals(8, outcome.foldedMessages());

        ChatProfile profile = stores.getStore().getProfile(CHAT).orElseThrow();
        assertEquals("profile #1", profile.profileText());
        assertEquals(messages.get(7).id(), profile.lastFoldedId());

        assertEquals("", summarizer.previousProfiles.get(0));
        String transcript = summarizer.transcripts.get(0);
        assertEquals(8, transcript.split("\n").length);
        assertTrue(transcript.startsWith("User: turn 0\nAssistant: turn 1"));
        assertEquals(ArchiveState.IDLE, registry.handle(CHAT).getArchiveState());
    }

    @Test
    void idle_chat_compacts_a_small_buffer() {
        List<ChatMessage> messages = appendTurns(6, NOW.minus(Duration.ofHours(4)));
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1000000");

        ArchiveOutcome outcome = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.COMPACTED, outcome.status());
        assertEquals(TriggerReason.IDLE, outcome.reason());
        assertEquals(messages.get(3).id(), outcome.lastFoldedId());
    }

    @Test
    void recent_small_buffer_does_not_trigger() {
        List<ChatMessage> messages = appendTurns(6, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1000000");

        ArchiveOutcome outcome = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.NOT_TRIGGERED, outcome.status());
        assertNull(outcome.reason());
        assertTrue(summarizer.transcripts.isEmpty());
        assertEquals(ArchiveState.BUFFER_GROWING, registry.handle(CHAT).getArchiveState());
    }

    @Test
    void chat_that_fits_the_window_stays_idle() {
        appendTurns(3, NOW.minus(Duration.ofDays(1)));

        ArchiveOutcome outcome = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.NOT_TRIGGERED, outcome.status());
        assertEquals(ArchiveState.IDLE, registry.handle(CHAT).getArchiveState());
    }

    @Test
    void failed_summarization_leaves_pointer_and_retries_next_pass() {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        summarizer.behavior =
                (old, text) -> {
                    throw new SummarizationFailedException("model unavailable");
                };

        ArchiveOutcome failed = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.FAILED, failed.status());
        assertEquals(0L, failed.lastFoldedId());
        assertTrue(stores.getStore().getProfile(CHAT).isEmpty());
        assertEquals(ArchiveState.BUFFER_GROWING, registry.handle(CHAT).getArchiveState());

        summarizer.behavior = null;
        ArchiveOutcome retried = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.COMPACTED, retried.status());
        assertEquals(summarizer.transcripts.get(0), summarizer.transcripts.get(1));
    }

    @Test
    void blank_profile_counts_as_failure() {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        summarizer.behavior = (old, text) -> "  ";

        ArchiveOutcome outcome = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.FAILED, outcome.status());
        assertTrue(stores.getStore().getProfile(CHAT).isEmpty());
    }

    @Test
    void disabled_summarizer_fails_without_moving_the_pointer() {
        service.summarizer = new DisabledSummarizer();
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");

        assertEquals(ArchiveOutcome.Status.FAILED, service.maybeArchive(CHAT).status());
        assertTrue(stores.getStore().getProfile(CHAT).isEmpty());
    }

    @Test
    void attempts_within_debounce_interval_are_dropped() {
        service.debounce = Duration.ofSeconds(5);
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        summarizer.behavior =
                (old, text) -> {
                    throw new SummarizationFailedException("model unavailable");
                };

        assertEquals(ArchiveOutcome.Status.FAILED, service.maybeArchive(CHAT).status());
        assertEquals(
                ArchiveOutcome.Status.SKIPPED_DEBOUNCED, service.maybeArchive(CHAT).status());

        summarizer.behavior = null;
        service.clock = Clock.fixed(NOW.plusSeconds(6), ZoneOffset.UTC);
        assertEquals(ArchiveOutcome.Status.COMPACTED, service.maybeArchive(CHAT).status());
    }

    @Test
    void concurrent_pass_for_the_same_chat_is_dropped() throws Exception {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        summarizer.behavior =
                (old, text) -> {
                    entered.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return "slow profile";
                };

        CompletableFuture<ArchiveOutcome> first =
                CompletableFuture.supplyAsync(() -> service.maybeArchive(CHAT));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        ArchiveOutcome second = service.maybeArchive(CHAT);
        release.countDown();

        assertEquals(ArchiveOutcome.Status.SKIPPED_IN_FLIGHT, second.status());
        assertEquals(ArchiveOutcome.Status.COMPACTED, first.get(5, TimeUnit.SECONDS).status());
        assertEquals(1, summarizer.transcripts.size());
    }

    @Test
    void pointer_only_moves_forward_across_passes() {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");

        long first = service.maybeArchive(CHAT).lastFoldedId();
        assertEquals(
                ArchiveOutcome.Status.NOT_TRIGGERED, service.maybeArchive(CHAT).status());

        List<ChatMessage> more = appendTurns(4, NOW);
        ArchiveOutcome second = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.COMPACTED, second.status());
        assertTrue(second.lastFoldedId() > first);
        assertEquals("profile #1", summarizer.previousProfiles.get(1));
        assertFalse(summarizer.transcripts.get(1).contains("turn 7"));
        assertEquals(more.get(1).id(), second.lastFoldedId());
    }

    @Test
    void appends_proceed_while_the_summarizer_is_running() throws Exception {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        summarizer.behavior = parkUntil(entered, release);

        CompletableFuture<ArchiveOutcome> pass =
                CompletableFuture.supplyAsync(() -> service.maybeArchive(CHAT));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        CompletableFuture<ChatMessage> append =
                CompletableFuture.supplyAsync(
                        () ->
                                registry.withChatLock(
                                        CHAT,
                                        () ->
                                                stores.getStore()
                                                        .appendMessage(
                                                                NewMessage.text(
                                                                        CHAT,
                                                                        MessageRole.USER,
                                                                        "late question"))));
        ChatMessage late = append.get(2, TimeUnit.SECONDS);
        release.countDown();

        ArchiveOutcome outcome = pass.get(5, TimeUnit.SECONDS);
        assertEquals(ArchiveOutcome.Status.COMPACTED, outcome.status());
        assertEquals(messages.get(7).id(), outcome.lastFoldedId());
        assertTrue(late.id() > outcome.lastFoldedId());
    }

    @Test
    void reset_during_summarization_discards_the_profile() throws Exception {
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        summarizer.behavior = parkUntil(entered, release);

        CompletableFuture<ArchiveOutcome> pass =
                CompletableFuture.supplyAsync(() -> service.maybeArchive(CHAT));
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        registry.withChatLock(
                CHAT,
                () -> {
                    stores.getStore().deleteProfile(CHAT);
                    stores.getStore().deleteChat(CHAT);
                    registry.resetState(CHAT);
                });
        release.countDown();

        ArchiveOutcome outcome = pass.get(5, TimeUnit.SECONDS);
        assertEquals(ArchiveOutcome.Status.DISCARDED, outcome.status());
        assertEquals(0L, outcome.lastFoldedId());
        assertTrue(stores.getStore().getProfile(CHAT).isEmpty());
        assertEquals(ArchiveState.BUFFER_GROWING, registry.handle(CHAT).getArchiveState());
    }

    @Test
    void store_failure_mid_pass_reports_failed_outcome() {
        InMemoryChatStore store = spy(new InMemoryChatStore());
        stores = TestSelectors.inMemoryStore(store);
        settings = TestSelectors.settings(stores);
        service.storeSelector = stores;
        service.windowSelector = TestWindow.selector(stores);
        service.settings = settings;
        List<ChatMessage> messages = appendTurns(10, NOW);
        useWindowOfLast(messages, 2);
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        doCallRealMethod()
                .doThrow(new IllegalStateException("connection reset"))
                .when(store)
                .getProfile(CHAT);

        ArchiveOutcome outcome = service.maybeArchive(CHAT);

        assertEquals(ArchiveOutcome.Status.FAILED, outcome.status());
        assertEquals(TriggerReason.THRESHOLD, outcome.reason());
        assertEquals(0L, outcome.lastFoldedId());
        assertEquals(ArchiveState.BUFFER_GROWING, registry.handle(CHAT).getArchiveState());
    }

    private static BiFunction<String, String, String> parkUntil(
            CountDownLatch entered, CountDownLatch release) {
        return (old, text) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "slow profile";
        };
    }

    private List<ChatMessage> appendTurns(int count, Instant at) {
        List<ChatMessage> appended = new ArrayList<>();
        OffsetDateTime time = OffsetDateTime.ofInstant(at, ZoneOffset.UTC);
        for (int i = 0; i < count; i++) {
            MessageRole role = i % 2 == 0 ? MessageRole.USER : MessageRole.ASSISTANT;
            appended.add(
                    stores.getStore()
                            .appendMessage(NewMessage.text(CHAT, role, "turn " + i).at(time)));
        }
        return appended;
    }

    // Sizes the window so that exactly the last n messages fit.
    private void useWindowOfLast(List<ChatMessage> messages, int n) {
        int budget = 0;
        for (ChatMessage message : messages.subList(messages.size() - n, messages.size())) {
            budget += renderer.cost(message);
        }
        settings.update(MemorySettings.WINDOW_TOKENS, String.valueOf(budget));
    }

    private static class ScriptedSummarizer implements Summarizer {

        final List<String> previousProfiles = new ArrayList<>();
        final List<String> transcripts = new ArrayList<>();
        volatile BiFunction<String, String, String> behavior;

        @Override
        public boolean isEnabled() {
            return true;
        }

        @Override
        public synchronized String summarize(String previousProfile, String transcript) {
            previousProfiles.add(previousProfile);
            transcripts.add(transcript);
            if (behavior != null) {
                return behavior.apply(previousProfile, transcript);
            }
            return "profile #" + transcripts.size();
        }
    }
}
