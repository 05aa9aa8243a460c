package io.github.chirino.recall.config;

import io.github.chirino.recall.vector.InMemoryVectorStore;
import io.github.chirino.recall.vector.PgVectorStore;
import io.github.chirino.recall.vector.VectorStore;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class VectorStoreSelector {

    @ConfigProperty(name = "chat-recall.vector.type", defaultValue = "auto")
    String vectorType;

    @Inject ChatStoreSelector chatStoreSelector;

    @Inject Instance<PgVectorStore> pgVectorStore;

    @Inject Instance<InMemoryVectorStore> inMemoryVectorStore;

    public VectorStore getVectorStore() {
        String type = vectorType == null ? "auto" : vectorType.trim().toLowerCase();
        return switch (type) {
            case "pgvector", "postgres" -> pgVectorStore.get();
            case "memory", "in-memory" -> inMemoryVectorStore.get();
            case "auto" -> defaultForDatastore();
            default ->
                    throw new IllegalStateException(
                            "Unsupported chat-recall.vector.type: " + vectorType);
        };
    }

    /** When no explicit vector type is configured, keep vectors next to the messages. */
    private VectorStore defaultForDatastore() {
        return chatStoreSelector.isPostgres() ? pgVectorStore.get() : inMemoryVectorStore.get();
    }
}
