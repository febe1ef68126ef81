package com.harvester.api;

/**
 * Platform neutral handle of a channel, group or private chat.
 */
public record ChannelRef(
        long id,          // bare id as used in t.me/c/<id>/... links
        String title,
        String username,  // without "@", may be null
        Type type
) {
    public enum Type { CHANNEL, GROUP, PRIVATE }

    public boolean isChannelOrGroup() {
        return type == Type.CHANNEL || type == Type.GROUP;
    }

    public String displayName() {
        if (title != null && !title.isBlank()) return title;
        if (username != null && !username.isBlank()) return "@" + username;
        return String.valueOf(id);
    }
}
