package com.harvester.core.link;

import java.util.regex.Pattern;

/**
 * Channel and message ids of a t.me/c/&lt;channel&gt;/&lt;message&gt; deep link.
 */
public record ChannelPostAddress(String channelPart, long messageId) {

    // Private channel deep links carry the bare id; the API handle is -100<id>
    private static final String CHANNEL_HANDLE_PREFIX = "-100";
    private static final Pattern ASCII_ID = Pattern.compile("[0-9]+");

    /**
     * @throws IllegalArgumentException when the link has no numeric channel and message
     *                                  ids, or an id does not fit a channel handle
     */
    public static ChannelPostAddress parse(String link) {
        String trimmed = link;
        while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);

        String[] parts = trimmed.split("/");
        if (parts.length < 2) {
            throw new IllegalArgumentException("Not a channel post link: " + link);
        }
        String channelPart = parts[parts.length - 2];
        String messagePart = parts[parts.length - 1];
        if (!ASCII_ID.matcher(channelPart).matches() || !ASCII_ID.matcher(messagePart).matches()) {
            throw new IllegalArgumentException("Not a channel post link: " + link);
        }
        try {
            Long.parseLong(CHANNEL_HANDLE_PREFIX + channelPart);
            return new ChannelPostAddress(channelPart, Long.parseLong(messagePart));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Channel post id out of range: " + link, e);
        }
    }

    public long channelId() {
        return Long.parseLong(channelPart);
    }

    public long channelHandle() {
        return Long.parseLong(CHANNEL_HANDLE_PREFIX + channelPart);
    }

    public String folderName() {
        return "tg_" + channelPart + "_" + messageId;
    }
}
