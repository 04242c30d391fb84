package net.relaytrace.Message;

import org.springframework.lang.Nullable;

/**
 * The three kinds of message that flow through a dispatch bus.
 */
public enum MessageKind {

    COMMAND("Command", "command", true),
    QUERY("Query", "query", true),
    EVENT("Event", "event", false);

    private final String verb;
    private final String tag;
    private final boolean requestResponse;

    MessageKind(String verb, String tag, boolean requestResponse) {
        this.verb = verb;
        this.tag = tag;
        this.requestResponse = requestResponse;
    }

    /**
     * @return the prefix used in dispatch span names, e.g. "Command"
     */
    public String getVerb() {
        return verb;
    }

    /**
     * @return the value written to the message-kind span attribute, e.g. "command"
     */
    public String getTag() {
        return tag;
    }

    /**
     * @return true if the dispatcher awaits a result (commands and queries),
     *         false for fire-and-forget messages (events)
     */
    public boolean isRequestResponse() {
        return requestResponse;
    }

    /**
     * Resolves a span attribute tag back to its kind.
     *
     * @return the kind, or null if the tag is not recognised
     */
    @Nullable
    public static MessageKind fromTag(@Nullable String tag) {
        if (tag == null) {
            return null;
        }
        for (MessageKind kind : values()) {
            if (kind.tag.equals(tag)) {
                return kind;
            }
        }
        return null;
    }
}
