package io.github.chirino.recall.store.impl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.ChatProfile;
import io.github.chirino.recall.model.MessageRole;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.store.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryChatStoreTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private InMemoryChatStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryChatStore();
        store.clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    void ids_are_global_and_increasing() {
        ChatMessage a = append(1L, "a");
        ChatMessage b = append(2L, "b");
        ChatMessage c = append(1L, "c");

        assertTrue(a.id() < b.id() && b.id() < c.id());
        assertEquals(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), a.createdAt());
        assertEquals(List.of(1L, 2L), store.listChatIds());
    }

    @Test
    void neighbors_follow_log_order_within_the_chat() {
        ChatMessage m1 = append(1L, "one");
        append(2L, "other chat");
        ChatMessage m2 = append(1L, "two");
        ChatMessage m3 = append(1L, "three");
        ChatMessage m4 = append(1L, "four");

        assertEquals(List.of(m2, m1), store.listBefore(1L, m3.id(), 5));
        assertEquals(List.of(m4), store.listAfter(1L, m3.id(), 5));
        assertEquals(List.of(m4, m3), store.listRecent(1L, 2));
        assertEquals(List.of(m2, m3), store.listRange(1L, m1.id(), m4.id()));
        assertEquals(List.of(), store.listRange(1L, m2.id(), m3.id()));
        assertEquals(m4, store.newestMessage(1L).orElseThrow());
    }

    @Test
    void find_by_ids_ignores_other_chats() {
        ChatMessage mine = append(1L, "mine");
        ChatMessage theirs = append(2L, "theirs");

        assertEquals(List.of(mine), store.findByIds(1L, List.of(theirs.id(), mine.id(), 999L)));
    }

    @Test
    void patch_replaces_content_only() {
        ChatMessage original = append(1L, "[Voice: Processing...]");

        ChatMessage patched = store.patchContent(original.id(), "hello there");

        assertEquals("hello there", patched.content());
        assertEquals(original.createdAt(), patched.createdAt());
        assertEquals(patched, store.findMessage(original.id()).orElseThrow());
        assertThrows(ResourceNotFoundException.class, () -> store.patchContent(12345L, "x"));
    }

    @Test
    void profile_pointer_never_moves_backwards() {
        store.upsertProfile(new ChatProfile(1L, "newer", 10L, null));
        store.upsertProfile(new ChatProfile(1L, "stale", 4L, null));

        assertEquals("newer", store.getProfile(1L).orElseThrow().profileText());
    }

    @Test
    void delete_chat_removes_messages_only_of_that_chat() {
        ChatMessage gone = append(1L, "x");
        append(1L, "y");
        append(2L, "z");

        assertEquals(2, store.deleteChat(1L));
        assertEquals(0, store.countMessages(1L));
        assertTrue(store.findMessage(gone.id()).isEmpty());
        assertEquals(List.of(2L), store.listChatIds());
    }

    private ChatMessage append(long chatId, String content) {
        return store.appendMessage(NewMessage.text(chatId, MessageRole.USER, content));
    }
}
