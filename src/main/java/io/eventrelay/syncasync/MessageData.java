package io.eventrelay.syncasync;

import io.eventrelay.core.model.Data;

import java.util.List;

/**
 * Data rows of a message.
 *
 * @param complete false if some referenced rows are not (fully) stored yet
 */
public record MessageData(List<Data> data, boolean complete) {
    public MessageData {
        data = data == null ? List.of() : List.copyOf(data);
    }
}
