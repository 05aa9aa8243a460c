package io.github.chirino.recall.store;

/** A message referenced by a request is missing, or belongs to a different chat. */
public class ResourceNotFoundException extends RuntimeException {

    private final String resource;
    private final String id;

    private ResourceNotFoundException(String resource, String id, String message) {
        super(message);
        this.resource = resource;
        this.id = id;
    }

    public static ResourceNotFoundException message(long messageId) {
        return new ResourceNotFoundException(
                "message", String.valueOf(messageId), "Message " + messageId + " does not exist");
    }

    public static ResourceNotFoundException messageInChat(long chatId, long messageId) {
        return new ResourceNotFoundException(
                "message",
                String.valueOf(messageId),
                "Message " + messageId + " does not exist in chat " + chatId);
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
