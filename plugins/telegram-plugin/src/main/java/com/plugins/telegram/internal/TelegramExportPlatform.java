package com.plugins.telegram.internal;

import com.harvester.api.ChannelMessage;
import com.harvester.api.ChannelRef;
import com.harvester.api.MessageCursor;
import com.harvester.api.MessageFilter;
import com.harvester.api.MessagingPlatform;
import com.harvester.api.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link MessagingPlatform} backed by Telegram Desktop JSON exports on disk.
 * All exports are read once when the platform is opened.
 */
public class TelegramExportPlatform implements MessagingPlatform {
    private static final Logger logger = LoggerFactory.getLogger(TelegramExportPlatform.class);

    private final Path exportsDir;
    private final Map<Long, ExportedChat> chats;

    private TelegramExportPlatform(Path exportsDir, Map<Long, ExportedChat> chats) {
        this.exportsDir = exportsDir;
        this.chats = chats;
    }

    public static TelegramExportPlatform open(Path exportsDir) throws PlatformException {
        if (!Files.isDirectory(exportsDir)) {
            logger.warn("⚠️ Exports directory {} does not exist, no channels available", exportsDir.toAbsolutePath());
            return new TelegramExportPlatform(exportsDir, Map.of());
        }
        try {
            Map<Long, ExportedChat> chats = new ExportReader().readAll(exportsDir);
            logger.info("✅ {} chat(s) loaded from {}", chats.size(), exportsDir.toAbsolutePath());
            return new TelegramExportPlatform(exportsDir, chats);
        } catch (IOException e) {
            throw new PlatformException("Cannot read exports in " + exportsDir, e);
        }
    }

    @Override
    public String getName() {
        return "telegram-export";
    }

    public Path getExportsDir() {
        return exportsDir;
    }

    @Override
    public ChannelRef resolveChannel(String reference) throws PlatformException {
        String ref = reference.trim();
        if (ref.matches("-?[0-9]+")) {
            long id;
            try {
                id = Long.parseLong(ref);
            } catch (NumberFormatException e) {
                throw new PlatformException("Channel id out of range: " + reference, e);
            }
            return resolveChannel(id);
        }

        String wanted = ref.startsWith("@") ? ref.substring(1) : ref;
        for (ExportedChat chat : chats.values()) {
            ChannelRef channel = chat.ref();
            if (wanted.equalsIgnoreCase(channel.username())) return channel;
        }
        for (ExportedChat chat : chats.values()) {
            ChannelRef channel = chat.ref();
            if (wanted.equalsIgnoreCase(channel.title())) return channel;
        }
        throw new PlatformException("Unknown channel: " + reference);
    }

    @Override
    public ChannelRef resolveChannel(long channelId) throws PlatformException {
        ExportedChat chat = chats.get(ExportReader.bareId(channelId));
        if (chat == null) {
            throw new PlatformException("Channel " + channelId + " is not part of any export");
        }
        return chat.ref();
    }

    @Override
    public Optional<ChannelMessage> getMessage(ChannelRef channel, long messageId) throws PlatformException {
        ExportedChat.ExportedMessage message = chat(channel).get(messageId);
        return message == null ? Optional.empty() : Optional.of(message.message());
    }

    @Override
    public MessageCursor iterateHistory(ChannelRef channel, MessageFilter filter) throws PlatformException {
        Iterator<ExportedChat.ExportedMessage> it = chat(channel).newestFirst().iterator();
        return () -> {
            while (it.hasNext()) {
                ExportedChat.ExportedMessage next = it.next();
                if (filter == MessageFilter.URL && !next.hasLink()) continue;
                return next.message();
            }
            return null;
        };
    }

    @Override
    public Path downloadMedia(ChannelMessage message, Path destinationFolder) throws PlatformException, IOException {
        if (!message.hasMedia()) {
            throw new PlatformException("Message " + message.id() + " has no media");
        }
        Path source = Path.of(message.media().locator());
        if (!Files.isRegularFile(source)) {
            throw new PlatformException("Media of message " + message.id() + " missing from export: " + source);
        }

        Path target = destinationFolder.resolve(message.media().fileName());
        if (Files.exists(target)) {
            logger.debug("Media already present: {}", target);
            return target;
        }

        Files.createDirectories(destinationFolder);
        Path temp = Files.createTempFile(destinationFolder, target.getFileName().toString(), ".part");
        try {
            Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }
        return target;
    }

    @Override
    public List<ChannelRef> listDialogs() {
        List<ChannelRef> dialogs = new ArrayList<>();
        for (ExportedChat chat : chats.values()) {
            dialogs.add(chat.ref());
        }
        return dialogs;
    }

    private ExportedChat chat(ChannelRef channel) throws PlatformException {
        ExportedChat chat = chats.get(channel.id());
        if (chat == null) {
            throw new PlatformException("Channel " + channel.displayName() + " is not part of any export");
        }
        return chat;
    }
}
