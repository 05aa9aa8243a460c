package io.github.chirino.recall.service;

import io.github.chirino.recall.archive.ArchiveState;
import io.github.chirino.recall.window.WindowStats;
import java.time.OffsetDateTime;

public record ChatStats(
        long chatId,
        long messageCount,
        long indexedAnchors,
        ArchiveState archiveState,
        boolean hasProfile,
        OffsetDateTime profileUpdatedAt,
        WindowStats window) {}
