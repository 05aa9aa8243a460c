package io.github.chirino.recall.api.dto;

import jakarta.validation.constraints.NotNull;

public class PatchMessageRequest {

    @NotNull private String content;

    public String getContent() {
        return content;
    }

    public void setContent(String content) {
        this.content = content;
    }
}
