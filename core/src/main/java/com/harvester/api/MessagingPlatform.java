package com.harvester.api;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Capability interface for a messaging platform (channels, messages, attached media).
 * Implementations are provided by plugins through {@link PlatformProvider}.
 */
public interface MessagingPlatform extends AutoCloseable {

    /**
     * Human readable name of the backing platform (e.g. "telegram-export").
     */
    String getName();

    /**
     * Resolve a channel by user supplied reference: "@username", a title or a numeric id.
     *
     * @throws PlatformException if the channel is unknown or not accessible
     */
    ChannelRef resolveChannel(String reference) throws PlatformException;

    /**
     * Resolve a channel by its platform handle (e.g. -1001234567890).
     *
     * @throws PlatformException if the channel is unknown or not accessible
     */
    ChannelRef resolveChannel(long channelId) throws PlatformException;

    /**
     * Look up a single message of a channel.
     *
     * @return the message, or empty if the channel has no message with that id
     * @throws PlatformException on access problems
     */
    Optional<ChannelMessage> getMessage(ChannelRef channel, long messageId) throws PlatformException;

    /**
     * Lazily iterate the message history of a channel, newest first.
     */
    MessageCursor iterateHistory(ChannelRef channel, MessageFilter filter) throws PlatformException;

    /**
     * Store the media attached to a message inside the given folder.
     *
     * @return the written file
     * @throws PlatformException if the media cannot be retrieved from the platform
     * @throws IOException       if the local write fails
     */
    Path downloadMedia(ChannelMessage message, Path destinationFolder) throws PlatformException, IOException;

    /**
     * All dialogs (channels, groups, private chats) the configured account can see.
     */
    List<ChannelRef> listDialogs() throws PlatformException;

    @Override
    default void close() {
    }
}
