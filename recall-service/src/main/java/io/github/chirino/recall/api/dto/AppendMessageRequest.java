package io.github.chirino.recall.api.dto;

import io.github.chirino.recall.model.MessageKind;
import io.github.chirino.recall.model.MessageRole;
import jakarta.validation.constraints.NotNull;
import java.time.OffsetDateTime;

public class AppendMessageRequest {

    @NotNull private MessageRole role;
    private MessageKind kind;
    @NotNull private String content;
    private Long platformMessageId;
    private Long replyToId;

    /** Full text of the quoted message; only a short snippet of it is stored. */
    private String replyToText;

    private OffsetDateTime createdAt;

    public MessageRole getRole() {
        return role;
    }

    public void setRole(MessageRole role) {
        this.role = role;
    }

    public MessageKind getKind() {
        return kind;
    }

    public void setKind(MessageKind kind) {
        this.kind = kind;
    }

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }

    public Long getPlatformMessageId() {
        return platformMessageId;
    }

    public void setPlatformMessageId(Long platformMessageId) {
        this.platformMessageId = platformMessageId;
    }

    public Long getReplyToId() {
        return replyToId;
    }

    public void setReplyToId(Long replyToId) {
        this.replyToId = replyToId;
    }

    public String getReplyToText() {
        return replyToText;
    }

    public void setReplyToText(String replyToText) {
        this.replyToText = replyToText;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(OffsetDateTime createdAt) {
        this.createdAt = createdAt;
    }
}
