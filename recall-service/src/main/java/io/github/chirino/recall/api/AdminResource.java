package io.github.chirino.recall.api;

import io.github.chirino.recall.api.dto.UpdateSettingRequest;
import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.config.MemorySettings;
import io.github.chirino.recall.service.ChatAdminService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import java.util.Map;

@Path("/v1/admin")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AdminResource {

    @Inject ChatAdminService adminService;

    @Inject ChatStoreSelector storeSelector;

    @Inject MemorySettings settings;

    @GET
    @Path("/chats")
    public List<Long> listChats() {
        return storeSelector.getStore().listChatIds();
    }

    @DELETE
    @Path("/index")
    public Map<String, Long> clearAllIndexes() {
        return Map.of("removed", adminService.clearAllIndexes());
    }

    /** Effective value of every tunable. */
    @GET
    @Path("/settings")
    public Map<String, String> listSettings() {
        return settings.effective();
    }

    /** Only the values persisted in the settings table. */
    @GET
    @Path("/settings/overrides")
    public Map<String, String> listOverrides() {
        return storeSelector.getStore().listSettings();
    }

    @PUT
    @Path("/settings/{key}")
    public Map<String, String> updateSetting(
            @PathParam("key") String key, UpdateSettingRequest request) {
        settings.update(key, request == null ? null : request.getValue());
        return settings.effective();
    }
}
