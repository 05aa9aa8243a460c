package io.github.chirino.recall.config;

import io.github.chirino.recall.store.ChatStore;
import io.github.chirino.recall.store.MeteredChatStore;
import io.github.chirino.recall.store.impl.InMemoryChatStore;
import io.github.chirino.recall.store.impl.PostgresChatStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class ChatStoreSelector {

    @ConfigProperty(name = "chat-recall.datastore.type", defaultValue = "postgres")
    String datastoreType;

    @Inject Instance<PostgresChatStore> postgresChatStore;

    @Inject Instance<InMemoryChatStore> inMemoryChatStore;

    @Inject MeterRegistry meterRegistry;

    private ChatStore meteredStore;

    @PostConstruct
    void init() {
        ChatStore delegate = selectDelegate();
        meteredStore = new MeteredChatStore(meterRegistry, delegate);
    }

    public ChatStore getStore() {
        return meteredStore;
    }

    public boolean isPostgres() {
        return "postgres".equals(normalizedType());
    }

    private ChatStore selectDelegate() {
        String type = normalizedType();
        if ("postgres".equals(type)) {
            return postgresChatStore.get();
        }
        if ("memory".equals(type) || "in-memory".equals(type)) {
            return inMemoryChatStore.get();
        }
        throw new IllegalStateException(
                "Unsupported chat-recall.datastore.type: " + datastoreType);
    }

    private String normalizedType() {
        return datastoreType == null ? "postgres" : datastoreType.trim().toLowerCase();
    }
}
