package io.github.chirino.recall.api;

import io.github.chirino.recall.api.dto.AppendMessageRequest;
import io.github.chirino.recall.api.dto.ContextRequest;
import io.github.chirino.recall.api.dto.PatchMessageRequest;
import io.github.chirino.recall.archive.ArchiveOutcome;
import io.github.chirino.recall.archive.ArchiveService;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.model.ChatMessage;
import io.github.chirino.recall.model.NewMessage;
import io.github.chirino.recall.service.AssembledContext;
import io.github.chirino.recall.service.ChatAdminService;
import io.github.chirino.recall.service.ChatStats;
import io.github.chirino.recall.service.ContextAssembler;
import io.github.chirino.recall.vector.ContextRetriever;
import io.github.chirino.recall.vector.RetrievalResult;
import io.github.chirino.recall.vector.SemanticIndexer;
import io.github.chirino.recall.vector.SyncResult;
import io.github.chirino.recall.window.ActiveWindow;
import io.github.chirino.recall.window.ActiveWindowSelector;
import jakarta.inject.Inject;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PATCH;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.HashSet;
import java.util.Set;

/** Administrative HTTP view of one chat's memory. */
@Path("/v1/chats/{chatId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ChatsResource {

    @Inject ChatAdminService adminService;

    @Inject ActiveWindowSelector windowSelector;

    @Inject ContextAssembler assembler;

    @Inject ContextRetriever retriever;

    @Inject SemanticIndexer indexer;

    @Inject ArchiveService archiveService;

    @Inject MemorySettings settings;

    @POST
    @Path("/messages")
    public Response appendMessage(
            @PathParam("chatId") long chatId, @Valid @NotNull AppendMessageRequest request) {
        NewMessage message =
                new NewMessage(
                        chatId,
                        request.getRole(),
                        request.getKind(),
                        request.getContent(),
                        request.getPlatformMessageId(),
                        request.getReplyToId(),
                        NewMessage.snippet(request.getReplyToText()),
                        request.getCreatedAt());
        ChatMessage stored = adminService.appendMessage(message);
        return Response.status(Response.Status.CREATED).entity(stored).build();
    }

    @PATCH
    @Path("/messages/{messageId}")
    public ChatMessage patchMessage(
            @PathParam("chatId") long chatId,
            @PathParam("messageId") long messageId,
            @Valid @NotNull PatchMessageRequest request) {
        return adminService.patchContent(chatId, messageId, request.getContent());
    }

    @GET
    @Path("/window")
    public ActiveWindow window(
            @PathParam("chatId") long chatId,
            @QueryParam("targetTokens") @Min(1) @Max(1_000_000) Integer targetTokens) {
        int target = targetTokens != null ? targetTokens : settings.windowTokens();
        return windowSelector.selectWindow(chatId, target);
    }

    @GET
    @Path("/stats")
    public ChatStats stats(@PathParam("chatId") long chatId) {
        return adminService.stats(chatId);
    }

    @POST
    @Path("/context")
    public AssembledContext assemble(
            @PathParam("chatId") long chatId, @Valid @NotNull ContextRequest request) {
        return assembler.assemble(chatId, request.getQuery(), excludeIds(request));
    }

    @POST
    @Path("/context/search")
    public RetrievalResult search(
            @PathParam("chatId") long chatId, @Valid @NotNull ContextRequest request) {
        int topK = request.getTopK() != null ? request.getTopK() : settings.topK();
        int padding =
                request.getPadding() != null
                        ? request.getPadding()
                        : settings.neighborhoodPadding();
        return retriever.search(chatId, request.getQuery(), excludeIds(request), topK, padding);
    }

    @DELETE
    public ChatAdminService.ResetSummary reset(@PathParam("chatId") long chatId) {
        return adminService.reset(chatId);
    }

    @POST
    @Path("/index/sync")
    public SyncResult syncIndex(@PathParam("chatId") long chatId) {
        return indexer.syncChat(chatId);
    }

    @POST
    @Path("/index/rebuild")
    public SyncResult rebuildIndex(@PathParam("chatId") long chatId) {
        return adminService.rebuildIndex(chatId);
    }

    @POST
    @Path("/archive")
    public ArchiveOutcome archive(@PathParam("chatId") long chatId) {
        return archiveService.maybeArchive(chatId);
    }

    private static Set<Long> excludeIds(ContextRequest request) {
        return request.getExcludeIds() == null
                ? Set.of()
                : new HashSet<>(request.getExcludeIds());
    }
}
