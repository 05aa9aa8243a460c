package io.github.chirino.recall.service;

import io.github.chirino.recall.archive.ArchiveOutcome;
import io.github.chirino.recall.archive.ArchiveService;
import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.vector.SemanticIndexer;
import io.github.chirino.recall.vector.SyncResult;
import io.quarkus.scheduler.Scheduled;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Runs the memory maintenance work off the request path: archive passes on a bounded worker pool,
 * periodic index syncs, idle archive sweeps and chat registry eviction. Failures are logged and
 * never propagate into the scheduler.
 */
@ApplicationScoped
public class BackgroundJobs {

    private static final Logger LOG = Logger.getLogger(BackgroundJobs.class);

    @Inject ChatStoreSelector storeSelector;

    @Inject ArchiveService archiveService;

    @Inject SemanticIndexer indexer;

    @Inject ChatRegistry registry;

    @ConfigProperty(name = "chat-recall.archive.workers", defaultValue = "2")
    int archiveWorkers;

    @ConfigProperty(name = "chat-recall.archive.queue-capacity", defaultValue = "100")
    int archiveQueueCapacity;

    private ThreadPoolExecutor archiveExecutor;

    @PostConstruct
    void init() {
        AtomicInteger counter = new AtomicInteger();
        int workers = Math.max(1, archiveWorkers);
        archiveExecutor =
                new ThreadPoolExecutor(
                        workers,
                        workers,
                        60,
                        TimeUnit.SECONDS,
                        new ArrayBlockingQueue<>(Math.max(1, archiveQueueCapacity)),
                        runnable -> {
                            Thread thread =
                                    new Thread(
                                            runnable,
                                            "chat-recall-archive-" + counter.incrementAndGet());
                            thread.setDaemon(true);
                            return thread;
                        });
        archiveExecutor.allowCoreThreadTimeOut(true);
    }

    @PreDestroy
    void shutdown() {
        archiveExecutor.shutdown();
        try {
            if (!archiveExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                archiveExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            archiveExecutor.shutdownNow();
        }
    }

    /** Queues an archive pass for the chat. The future never completes exceptionally. */
    public CompletableFuture<ArchiveOutcome> scheduleArchive(long chatId) {
        try {
            return CompletableFuture.supplyAsync(
                            () -> archiveService.maybeArchive(chatId), archiveExecutor)
                    .exceptionally(
                            e -> {
                                LOG.warnf(e, "Archive pass for chat %d failed", chatId);
                                return ArchiveOutcome.rejected();
                            });
        } catch (RejectedExecutionException e) {
            LOG.warnf("Archive queue full, dropping pass for chat %d", chatId);
            return CompletableFuture.completedFuture(ArchiveOutcome.rejected());
        }
    }

    @Scheduled(
            every = "${chat-recall.indexing.interval:2m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void syncAllIndexes() {
        int indexed = 0;
        for (Long chatId : chatIds()) {
            try {
                SyncResult result = indexer.syncChat(chatId);
                indexed += result.indexed();
            } catch (Exception e) {
                LOG.warnf(e, "Index sync for chat %d failed", chatId);
            }
        }
        if (indexed > 0) {
            LOG.infof("Index tick embedded %d anchors", indexed);
        }
    }

    /**
     * Idle compaction only fires when a pass runs, so quiet chats are visited periodically. Passes
     * run one after another on the scheduler thread rather than on the archive pool, so a sweep
     * over more chats than the pool can queue still reaches every chat.
     */
    @Scheduled(
            every = "${chat-recall.summary.sweep-interval:10m}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    public void sweepIdleArchives() {
        int compacted = 0;
        for (Long chatId : chatIds()) {
            try {
                if (archiveService.maybeArchive(chatId).isCompacted()) {
                    compacted++;
                }
            } catch (Exception e) {
                LOG.warnf(e, "Idle archive pass for chat %d failed", chatId);
            }
        }
        if (compacted > 0) {
            LOG.infof("Idle sweep compacted %d chats", compacted);
        }
    }

    @Scheduled(every = "${chat-recall.registry.sweep-interval:5m}")
    public void evictIdleChats() {
        try {
            registry.evictIdle();
        } catch (Exception e) {
            LOG.warnf(e, "Chat registry sweep failed");
        }
    }

    private List<Long> chatIds() {
        try {
            return storeSelector.getStore().listChatIds();
        } catch (Exception e) {
            LOG.warnf(e, "Could not list chats");
            return List.of();
        }
    }
}
