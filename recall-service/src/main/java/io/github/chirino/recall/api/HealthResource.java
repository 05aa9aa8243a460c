package io.github.chirino.recall.api;

import io.github.chirino.recall.archive.Summarizer;
import io.github.chirino.recall.config.ChatStoreSelector;
import io.github.chirino.recall.vector.EmbeddingGateway;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;

/** Reports which optional memory features are active in this process. */
@Path("/v1/health")
public class HealthResource {

    @Inject ChatStoreSelector storeSelector;

    @Inject EmbeddingGateway embeddingGateway;

    @Inject Summarizer summarizer;

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public Map<String, Object> health() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "ok");
        status.put("datastore", storeSelector.isPostgres() ? "postgres" : "memory");
        status.put("summarizer", summarizer.isEnabled());
        if (embeddingGateway.isEnabled()) {
            status.put("embedding", embeddingGateway.modelId());
            status.put("vectorDimension", embeddingGateway.dimension());
        } else {
            status.put("embedding", "none");
        }
        return status;
    }
}
