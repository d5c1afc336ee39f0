package io.eventrelay.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outbound shape of a message: the message itself with its data carried inline.
 * Used both for requests handed to the messaging service and for resolved replies.
 */
public record MessageInOut(Message message, List<InlineData> inlineData) {
    public MessageInOut {
        Objects.requireNonNull(message, "message");
        inlineData = inlineData == null ? List.of() : List.copyOf(inlineData);
    }

    public static MessageInOut of(final Message message, final List<Data> data) {
        return new MessageInOut(message, data.stream().map(InlineData::of).toList());
    }

    public MessageHeader header() {
        return message.header();
    }

    public MessageInOut withMessage(final Message newMessage) {
        return new MessageInOut(newMessage, inlineData);
    }
}
