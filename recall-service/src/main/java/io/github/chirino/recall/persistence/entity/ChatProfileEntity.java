package io.github.chirino.recall.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.OffsetDateTime;

@Entity
@Table(name = "chat_profiles")
public class ChatProfileEntity {

    @Id
    @Column(name = "chat_id", nullable = false, updatable = false)
    private Long chatId;

    @Column(name = "profile_text", nullable = false, columnDefinition = "text")
    private String profileText;

    @Column(name = "last_folded_id", nullable = false)
    private long lastFoldedId;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public Long getChatId() {
        return chatId;
    }

    public void setChatId(Long chatId) {
        this.chatId = chatId;
    }

    public String getProfileText() {
        return profileText;
    }

    public void setProfileText(String profileText) {
        this.profileText = profileText;
    }

    public long getLastFoldedId() {
        return lastFoldedId;
    }

    public void setLastFoldedId(long lastFoldedId) {
        this.lastFoldedId = lastFoldedId;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(OffsetDateTime updatedAt) {
        this.updatedAt = updatedAt;
    }
}
