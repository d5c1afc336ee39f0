package io.eventrelay.core.model;

import java.time.Instant;
import java.util.UUID;

/**
 * Routing and correlation metadata of a {@link Message}.
 *
 * @param cid   id of the request message this message replies to, null on requests
 * @param group identifier of the private group the message was sent to, null for broadcasts
 */
public record MessageHeader(UUID id,
                            UUID cid,
                            String namespace,
                            String author,
                            String topic,
                            String tag,
                            String context,
                            String group,
                            Instant created) {

    public static MessageHeader of(final String namespace, final String tag) {
        return new MessageHeader(null, null, namespace, null, null, tag, null, null, null);
    }

    public MessageHeader withId(final UUID newId) {
        return new MessageHeader(newId, cid, namespace, author, topic, tag, context, group, created);
    }

    public MessageHeader withCid(final UUID newCid) {
        return new MessageHeader(id, newCid, namespace, author, topic, tag, context, group, created);
    }

    public MessageHeader withTopic(final String newTopic) {
        return new MessageHeader(id, cid, namespace, author, newTopic, tag, context, group, created);
    }

    public MessageHeader withContext(final String newContext) {
        return new MessageHeader(id, cid, namespace, author, topic, tag, newContext, group, created);
    }

    public MessageHeader withGroup(final String newGroup) {
        return new MessageHeader(id, cid, namespace, author, topic, tag, context, newGroup, created);
    }
}
