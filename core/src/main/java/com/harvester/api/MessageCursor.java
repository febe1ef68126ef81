package com.harvester.api;

/**
 * Pull based, lazy view over a message history.
 */
public interface MessageCursor extends AutoCloseable {

    /**
     * @return the next message, or null once the history is exhausted
     */
    ChannelMessage next() throws PlatformException;

    @Override
    default void close() {
    }
}
