package com.harvester.services.ledger;

import java.time.Instant;

/**
 * One ledger row. Kind and timestamp are null for rows written before
 * those columns existed.
 */
public record ProcessedLink(
        String link,
        Kind kind,
        Instant downloadedAt
) {
    public enum Kind {
        PAGE("page"),
        CHANNEL_POST("channel-post");

        private final String value;

        Kind(String value) {
            this.value = value;
        }

        public String value() {
            return value;
        }

        public static Kind fromValue(String value) {
            if (value == null) return null;
            for (Kind kind : values()) {
                if (kind.value.equals(value)) return kind;
            }
            return null;
        }
    }
}
