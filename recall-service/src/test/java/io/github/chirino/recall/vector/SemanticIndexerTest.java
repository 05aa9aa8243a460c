package io.github.chirino.recall.vector;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.TestSelectors;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.MessageRole;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.service.ChatRegistry;
import io.github.chirino.recall.vector.TestVectors.KeywordEmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SemanticIndexerTest {

    private static final long CHAT = 3L;
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ChatStoreSelector stores;
    private InMemoryVectorStore vectorStore;
    private KeywordEmbeddingService embeddings;
    private SimpleMeterRegistry meterRegistry;
    private ChatRegistry registry;
    private SemanticIndexer indexer;

    @BeforeEach
    void setUp() {
        stores = TestSelectors.inMemoryStore();
        vectorStore = TestVectors.inMemory(stores);
        embeddings = new KeywordEmbeddingService("pizza", "weather", "java", "music");
        meterRegistry = new SimpleMeterRegistry();
        registry = new ChatRegistry();
        indexer =
                TestVectors.indexer(
                        stores,
                        TestSelectors.vectors(stores, vectorStore),
                        TestVectors.gateway(embeddings, 4, meterRegistry),
                        TestSelectors.settings(stores),
                        registry,
                        meterRegistry);
        indexer.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void indexes_only_assistant_messages_and_is_idempotent() {
        append(MessageRole.USER, "I love pizza");
        append(MessageRole.ASSISTANT, "Pizza is great");
        append(MessageRole.USER, "How is the weather?");
        append(MessageRole.ASSISTANT, "Sunny weather all week");
        append(MessageRole.USER, "thanks");

        SyncResult first = indexer.syncChat(CHAT);
        SyncResult second = indexer.syncChat(CHAT);

        assertEquals(SyncResult.Status.INDEXED, first.status());
        assertEquals(2, first.indexed());
        assertEquals(SyncResult.Status.UP_TO_DATE, second.status());
        assertEquals(2, vectorStore.countByChat(CHAT));
        assertEquals(
                2.0, meterRegistry.counter(SemanticIndexer.INDEXED_METRIC).count(), 0.0001);
    }

    @Test
    void anchors_without_content_are_marked_and_not_retried() {
        append(MessageRole.USER, "send a voice note");
        append(MessageRole.ASSISTANT, "[Voice: Processing...]");

        SyncResult first = indexer.syncChat(CHAT);
        int callsAfterFirst = embeddings.calls();
        SyncResult second = indexer.syncChat(CHAT);

        assertEquals(SyncResult.indexed(0, 1), first);
        assertEquals(SyncResult.Status.UP_TO_DATE, second.status());
        assertEquals(0, vectorStore.countByChat(CHAT));
        assertEquals(callsAfterFirst, embeddings.calls());
    }

    @Test
    void failure_starts_a_cooldown_that_suppresses_embedding_calls() {
        append(MessageRole.USER, "pizza?");
        append(MessageRole.ASSISTANT, "pizza!");
        embeddings.setFailing(true);

        assertEquals(SyncResult.Status.EMBEDDING_UNAVAILABLE, indexer.syncChat(CHAT).status());
        int calls = embeddings.calls();
        embeddings.setFailing(false);

        assertEquals(SyncResult.Status.SKIPPED_COOLDOWN, indexer.syncChat(CHAT).status());
        assertEquals(calls, embeddings.calls());
        assertTrue(registry.handle(CHAT).isIndexCoolingDown(NOW));
        assertEquals(
                1.0,
                meterRegistry
                        .counter(EmbeddingGateway.FAILURE_METRIC, "model", "test/keywords")
                        .count(),
                0.0001);

        indexer.clock = Clock.fixed(NOW.plusSeconds(181), ZoneOffset.UTC);
        assertEquals(SyncResult.Status.INDEXED, indexer.syncChat(CHAT).status());
        assertFalse(registry.handle(CHAT).isIndexCoolingDown(NOW));
    }

    @Test
    void clearing_the_chat_ends_the_cooldown() {
        append(MessageRole.USER, "pizza?");
        append(MessageRole.ASSISTANT, "pizza!");
        embeddings.setFailing(true);
        indexer.syncChat(CHAT);
        embeddings.setFailing(false);

        indexer.clearChat(CHAT);

        assertEquals(SyncResult.indexed(1, 0), indexer.syncChat(CHAT));
    }

    @Test
    void rebuild_walks_every_batch() {
        indexer.batchSize = 2;
        for (int i = 0; i < 5; i++) {
            append(MessageRole.USER, "question " + i);
            append(MessageRole.ASSISTANT, "java answer " + i);
        }
        indexer.syncChat(CHAT);

        SyncResult rebuilt = indexer.rebuildChat(CHAT);

        assertEquals(SyncResult.indexed(5, 0), rebuilt);
        assertEquals(5, vectorStore.countByChat(CHAT));
    }

    @Test
    void rebuild_of_an_empty_chat_is_up_to_date() {
        assertEquals(SyncResult.Status.UP_TO_DATE, indexer.rebuildChat(CHAT).status());
    }

    @Test
    void editing_a_question_reindexes_the_reply_that_follows() {
        ChatMessage question = append(MessageRole.USER, "what about music?");
        append(MessageRole.ASSISTANT, "Jazz is nice");
        append(MessageRole.USER, "and java?");
        append(MessageRole.ASSISTANT, "Java is a language");
        indexer.syncChat(CHAT);

        ChatMessage edited = stores.getStore().patchContent(question.id(), "what about pizza?");
        indexer.invalidate(edited);

        assertEquals(1, vectorStore.countByChat(CHAT));
        assertEquals(SyncResult.indexed(1, 0), indexer.syncChat(CHAT));
        List<VectorMatch> matches =
                vectorStore.search(CHAT, new float[] {1f, 0f, 0f, 0f}, Set.of(), 5, 0.6);
        assertEquals(1, matches.size());
        assertEquals(question.id() + 1, matches.get(0).messageId());
    }

    @Test
    void disabled_embeddings_do_nothing() {
        indexer.embeddingGateway =
                TestVectors.gateway(new DisabledEmbeddingService("test"), 4, meterRegistry);
        append(MessageRole.USER, "pizza?");
        append(MessageRole.ASSISTANT, "pizza!");

        assertEquals(SyncResult.Status.DISABLED, indexer.syncChat(CHAT).status());
        assertEquals(0, vectorStore.countByChat(CHAT));
    }

    private ChatMessage append(MessageRole role, String content) {
        return stores.getStore().appendMessage(NewMessage.text(CHAT, role, content));
    }
}
