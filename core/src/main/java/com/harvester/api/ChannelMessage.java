package com.harvester.api;

public record ChannelMessage(
        ChannelRef channel,
        long id,
        String text,
        MediaRef media
) {
    public boolean hasText() {
        return text != null && !text.isBlank();
    }

    public boolean hasMedia() {
        return media != null;
    }
}
