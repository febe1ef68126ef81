package com.plugins.telegram.internal;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.harvester.api.ChannelMessage;
import com.harvester.api.ChannelRef;
import com.harvester.api.MediaRef;
import com.harvester.common.util.FileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Parses Telegram Desktop "Export chat history" dumps (result.json).
 */
class ExportReader {
    private static final Logger logger = LoggerFactory.getLogger(ExportReader.class);

    static final String EXPORT_FILE = "result.json";
    static final String NOT_INCLUDED_PREFIX = "(File not included";

    /**
     * Read every export in the folder itself or one level below it.
     * Chats appearing in several exports are merged.
     */
    Map<Long, ExportedChat> readAll(Path exportsDir) throws IOException {
        Map<Long, ExportedChat> chats = new LinkedHashMap<>();
        for (Path export : findExports(exportsDir)) {
            try {
                read(export, chats);
            } catch (JsonParseException | IllegalStateException e) {
                logger.error("Skipping unreadable export {} - {}", export, e.getMessage());
            }
        }
        return chats;
    }

    List<Path> findExports(Path exportsDir) throws IOException {
        List<Path> exports = new ArrayList<>();
        Path direct = exportsDir.resolve(EXPORT_FILE);
        if (Files.isRegularFile(direct)) exports.add(direct);

        try (Stream<Path> children = Files.list(exportsDir)) {
            children.filter(Files::isDirectory)
                    .sorted()
                    .map(dir -> dir.resolve(EXPORT_FILE))
                    .filter(Files::isRegularFile)
                    .forEach(exports::add);
        }
        return exports;
    }

    void read(Path exportFile, Map<Long, ExportedChat> chats) throws IOException {
        logger.info("📦 Reading export: {}", exportFile);
        Path folder = exportFile.toAbsolutePath().getParent();

        try (FileReader reader = new FileReader(exportFile.toFile(), StandardCharsets.UTF_8)) {
            JsonObject root = JsonParser.parseReader(reader).getAsJsonObject();

            if (root.has("chats") && root.get("chats").isJsonObject()
                    && root.getAsJsonObject("chats").has("list")) {
                // full account export
                for (JsonElement chat : root.getAsJsonObject("chats").getAsJsonArray("list")) {
                    if (chat.isJsonObject()) readChat(chat.getAsJsonObject(), folder, chats);
                }
            } else if (root.has("messages")) {
                readChat(root, folder, chats);
            } else {
                logger.warn("{} is not a chat export", exportFile);
            }
        }
    }

    private void readChat(JsonObject chat, Path folder, Map<Long, ExportedChat> chats) {
        if (!chat.has("id")) return;

        long id = bareId(chat.get("id").getAsLong());
        ExportedChat exported = chats.get(id);
        if (exported == null) {
            ChannelRef ref = new ChannelRef(id, string(chat, "name"), username(chat), mapType(string(chat, "type")));
            exported = new ExportedChat(ref);
            chats.put(id, exported);
        }

        if (!chat.has("messages")) return;
        JsonArray messages = chat.getAsJsonArray("messages");
        int count = 0;
        for (JsonElement el : messages) {
            if (!el.isJsonObject()) continue;
            JsonObject msg = el.getAsJsonObject();
            if (!"message".equals(string(msg, "type")) || !msg.has("id")) continue;

            exported.add(toMessage(exported.ref(), msg, folder));
            count++;
        }
        logger.debug("Chat {} ({}): {} messages", exported.ref().displayName(), id, count);
    }

    private ExportedChat.ExportedMessage toMessage(ChannelRef ref, JsonObject msg, Path folder) {
        List<String> hiddenLinks = new ArrayList<>();
        boolean linkEntity = false;

        StringBuilder text = new StringBuilder();
        JsonElement t = msg.get("text");
        if (t != null && t.isJsonPrimitive()) {
            text.append(t.getAsString());
        } else if (t != null && t.isJsonArray()) {
            for (JsonElement part : t.getAsJsonArray()) {
                if (part.isJsonPrimitive()) {
                    text.append(part.getAsString());
                } else if (part.isJsonObject()) {
                    JsonObject entity = part.getAsJsonObject();
                    String type = string(entity, "type");
                    if (entity.has("text")) text.append(entity.get("text").getAsString());
                    if ("link".equals(type)) linkEntity = true;
                    if ("text_link".equals(type)) {
                        linkEntity = true;
                        String href = string(entity, "href");
                        if (href != null) hiddenLinks.add(href);
                    }
                }
            }
        }
        for (String href : hiddenLinks) {
            text.append('\n').append(href);
        }

        String body = text.toString();
        boolean hasLink = linkEntity || body.contains("http");
        ChannelMessage message = new ChannelMessage(ref, msg.get("id").getAsLong(), body, media(msg, folder));
        return new ExportedChat.ExportedMessage(message, hasLink);
    }

    private MediaRef media(JsonObject msg, Path folder) {
        String relative = string(msg, "photo");
        String mimeType = "image/jpeg";
        if (relative == null) {
            relative = string(msg, "file");
            mimeType = string(msg, "mime_type");
        }
        if (relative == null || relative.isBlank() || relative.startsWith(NOT_INCLUDED_PREFIX))
            return null;

        Path file = folder.resolve(relative).normalize();
        String fileName = FileNames.sanitize(string(msg, "file_name"));
        if (fileName.isBlank()) fileName = FileNames.sanitize(file.getFileName().toString());
        return new MediaRef(fileName, mimeType, file.toString());
    }

    /**
     * Strip the "-100" marker channel handles carry; bare ids pass through.
     */
    static long bareId(long id) {
        if (id >= 0) return id;
        String digits = Long.toString(-id);
        if (digits.startsWith("100") && digits.length() > 3) {
            return Long.parseLong(digits.substring(3));
        }
        return -id;
    }

    static ChannelRef.Type mapType(String type) {
        if (type == null) return ChannelRef.Type.PRIVATE;
        return switch (type) {
            case "public_channel", "private_channel" -> ChannelRef.Type.CHANNEL;
            case "public_supergroup", "private_supergroup", "private_group" -> ChannelRef.Type.GROUP;
            default -> ChannelRef.Type.PRIVATE;
        };
    }

    private static String username(JsonObject chat) {
        String username = string(chat, "username");
        if (username != null && username.startsWith("@")) username = username.substring(1);
        return username;
    }

    private static String string(JsonObject obj, String key) {
        if (!obj.has(key) || obj.get(key).isJsonNull() || !obj.get(key).isJsonPrimitive()) return null;
        return obj.get(key).getAsString();
    }
}
