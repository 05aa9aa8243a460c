package io.github.chirino.recall.api.dto;

/** A null value removes the override. */
public class UpdateSettingRequest {

    private String value;

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }
}
