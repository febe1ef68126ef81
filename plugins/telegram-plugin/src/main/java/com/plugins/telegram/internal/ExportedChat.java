package com.plugins.telegram.internal;

import com.harvester.api.ChannelMessage;
import com.harvester.api.ChannelRef;

import java.util.Collection;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * One chat as found in one or more exports, messages keyed by id.
 */
class ExportedChat {
    private final ChannelRef ref;
    private final NavigableMap<Long, ExportedMessage> messages = new TreeMap<>();

    ExportedChat(ChannelRef ref) {
        this.ref = ref;
    }

    record ExportedMessage(ChannelMessage message, boolean hasLink) {}

    ChannelRef ref() {
        return ref;
    }

    void add(ExportedMessage message) {
        // a later export of the same chat wins
        messages.put(message.message().id(), message);
    }

    ExportedMessage get(long id) {
        return messages.get(id);
    }

    Collection<ExportedMessage> newestFirst() {
        return messages.descendingMap().values();
    }

    int size() {
        return messages.size();
    }
}
