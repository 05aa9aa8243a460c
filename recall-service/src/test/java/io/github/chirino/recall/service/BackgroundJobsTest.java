package io.github.chirino.recall.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.github.chirino.recall.archive.ArchiveOutcome;
import io.github.chirino.recall.archive.ArchiveService;
import io.github.chirino.recall.archive.Summarizer;
import io.github.chirino.recall.archive.TestArchive;
import io.github.chirino.recall.archive.TriggerReason;
import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.config.TestSelectors;
import io.github.chirino.recall.model.MessageRole;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.vector.SemanticIndexer;
import io.github.chirino.recall.vector.SyncResult;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BackgroundJobsTest {

    private ChatStoreSelector stores;
    private ChatRegistry registry;
    private SemanticIndexer indexer;
    private BackgroundJobs jobs;

    @BeforeEach
    void setUp() {
        stores = TestSelectors.inMemoryStore();
        registry = new ChatRegistry();
        indexer = mock(SemanticIndexer.class);

        jobs = new BackgroundJobs();
        jobs.storeSelector = stores;
        jobs.indexer = indexer;
        jobs.registry = registry;
        jobs.archiveWorkers = 1;
        jobs.archiveQueueCapacity = 1;
    }

    @AfterEach
    void tearDown() {
        jobs.shutdown();
    }

    @Test
    void scheduled_archive_compacts_on_a_worker() throws Exception {
        MemorySettings settings = TestSelectors.settings(stores);
        settings.update(MemorySettings.WINDOW_TOKENS, "1");
        settings.update(MemorySettings.TRIGGER_TOKENS, "1");
        Summarizer summarizer = mock(Summarizer.class);
        when(summarizer.isEnabled()).thenReturn(true);
        when(summarizer.summarize(anyString(), anyString())).thenReturn("Likes short answers.");
        jobs.archiveService = TestArchive.service(stores, settings, registry, summarizer);
        jobs.init();
        for (int i = 0; i < 4; i++) {
            stores.getStore()
                    .appendMessage(NewMessage.text(1L, MessageRole.USER, "message " + i));
        }

        ArchiveOutcome outcome = jobs.scheduleArchive(1L).get(5, TimeUnit.SECONDS);

        assertEquals(ArchiveOutcome.Status.COMPACTED, outcome.status());
        assertEquals(TriggerReason.THRESHOLD, outcome.reason());
        assertEquals(3, outcome.foldedMessages());
        assertEquals(
                "Likes short answers.",
                stores.getStore().getProfile(1L).orElseThrow().profileText());
    }

    @Test
    void failing_pass_completes_as_rejected() throws Exception {
        ArchiveService archive = mock(ArchiveService.class);
        when(archive.maybeArchive(1L)).thenThrow(new IllegalStateException("db down"));
        jobs.archiveService = archive;
        jobs.init();

        ArchiveOutcome outcome = jobs.scheduleArchive(1L).get(5, TimeUnit.SECONDS);

        assertEquals(ArchiveOutcome.rejected(), outcome);
    }

    @Test
    void full_queue_rejects_without_blocking() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ArchiveService archive = mock(ArchiveService.class);
        when(archive.maybeArchive(1L))
                .thenAnswer(
                        invocation -> {
                            release.await(5, TimeUnit.SECONDS);
                            return ArchiveOutcome.notTriggered(0L);
                        });
        jobs.archiveService = archive;
        jobs.init();

        CompletableFuture<ArchiveOutcome> running = jobs.scheduleArchive(1L);
        CompletableFuture<ArchiveOutcome> queued = jobs.scheduleArchive(1L);
        CompletableFuture<ArchiveOutcome> dropped = jobs.scheduleArchive(1L);

        assertTrue(dropped.isDone());
        assertEquals(ArchiveOutcome.rejected(), dropped.get());
        release.countDown();
        ArchiveOutcome first = running.get(5, TimeUnit.SECONDS);
        ArchiveOutcome second = queued.get(5, TimeUnit.SECONDS);
        assertEquals(ArchiveOutcome.Status.NOT_TRIGGERED, first.status());
        assertEquals(ArchiveOutcome.Status.NOT_TRIGGERED, second.status());
    }

    @Test
    void index_tick_survives_a_failing_chat() {
        stores.getStore().appendMessage(NewMessage.text(1L, MessageRole.USER, "one"));
        stores.getStore().appendMessage(NewMessage.text(2L, MessageRole.USER, "two"));
        when(indexer.syncChat(1L)).thenThrow(new IllegalStateException("broken"));
        when(indexer.syncChat(2L)).thenReturn(SyncResult.indexed(1, 0));
        jobs.archiveService = mock(ArchiveService.class);
        jobs.init();

        jobs.syncAllIndexes();

        verify(indexer).syncChat(1L);
        verify(indexer).syncChat(2L);
    }

    @Test
    void idle_sweep_visits_every_chat() {
        stores.getStore().appendMessage(NewMessage.text(1L, MessageRole.USER, "one"));
        stores.getStore().appendMessage(NewMessage.text(2L, MessageRole.USER, "two"));
        ArchiveService archive = mock(ArchiveService.class);
        when(archive.maybeArchive(1L)).thenThrow(new IllegalStateException("store down"));
        when(archive.maybeArchive(2L)).thenReturn(ArchiveOutcome.notTriggered(0L));
        jobs.archiveService = archive;
        jobs.init();

        jobs.sweepIdleArchives();

        verify(archive).maybeArchive(1L);
        verify(archive).maybeArchive(2L);
    }

    @Test
    void idle_sweep_reaches_more_chats_than_the_pool_can_queue() {
        int chats = 300;
        for (long chatId = 1; chatId <= chats; chatId++) {
            stores.getStore().appendMessage(NewMessage.text(chatId, MessageRole.USER, "hi"));
        }
        ArchiveService archive = mock(ArchiveService.class);
        when(archive.maybeArchive(anyLong())).thenReturn(ArchiveOutcome.notTriggered(0L));
        jobs.archiveService = archive;
        jobs.init();

        jobs.sweepIdleArchives();

        verify(archive, times(chats)).maybeArchive(anyLong());
        verify(archive).maybeArchive(1L);
        verify(archive).maybeArchive(300L);
    }
}
