package me.golemcore.relay.adapter.outbound.channel;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.domain.service.TextChunker;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ChannelPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.io.File;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Sends Telegram messages with the Bot API.
 *
 * <p>
 * Text is split at {@value #TELEGRAM_MAX_MESSAGE_LENGTH} characters. Media
 * goes out as a photo for image extensions and as a document otherwise, with
 * the text as caption. URLs are passed to Telegram as-is; other values are
 * read as local files.
 */
@Component
@Slf4j
public class TelegramChannelAdapter implements ChannelPort {

    static final String CHANNEL_TYPE = "telegram";
    static final int TELEGRAM_MAX_MESSAGE_LENGTH = 4096;
    static final int TELEGRAM_MAX_CAPTION_LENGTH = 1024;
    private static final Set<String> PHOTO_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp");

    private final RelayProperties properties;

    private TelegramClient telegramClient;

    public TelegramChannelAdapter(RelayProperties properties) {
        this.properties = properties;
    }

    /**
     * Package-private setter for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public CompletableFuture<SendResult> send(String chatId, String text, String mediaUrl) {
        return CompletableFuture.supplyAsync(() -> {
            if (chatId == null || chatId.isBlank()) {
                throw new DeliveryException(CHANNEL_TYPE, "Telegram chatId is required");
            }
            TelegramClient client = client();
            String body = text != null ? text : "";
            try {
                Message message = mediaUrl != null && !mediaUrl.isBlank()
                        ? sendMedia(client, chatId.trim(), body, mediaUrl.trim())
                        : sendText(client, chatId.trim(), body);
                log.debug("[Telegram] Sent message {} to chat {}", message.getMessageId(), message.getChatId());
                return new SendResult(String.valueOf(message.getMessageId()), String.valueOf(message.getChatId()));
            } catch (TelegramApiException e) {
                throw new DeliveryException(CHANNEL_TYPE, "Telegram send failed: " + e.getMessage(), e);
            }
        });
    }

    private Message sendText(TelegramClient client, String chatId, String text) throws TelegramApiException {
        List<String> chunks = TextChunker.chunk(text, TELEGRAM_MAX_MESSAGE_LENGTH);
        if (chunks.isEmpty()) {
            throw new DeliveryException(CHANNEL_TYPE, "Message must be non-empty for Telegram sends");
        }
        Message last = null;
        for (String chunk : chunks) {
            last = client.execute(SendMessage.builder()
                    .chatId(chatId)
                    .text(chunk)
                    .build());
        }
        return last;
    }

    private Message sendMedia(TelegramClient client, String chatId, String caption, String mediaUrl)
            throws TelegramApiException {
        InputFile file = toInputFile(mediaUrl);
        if (isPhoto(mediaUrl)) {
            SendPhoto.SendPhotoBuilder<?, ?> builder = SendPhoto.builder()
                    .chatId(chatId)
                    .photo(file);
            if (!caption.isBlank()) {
                builder.caption(truncateCaption(caption));
            }
            return client.execute(builder.build());
        }
        SendDocument.SendDocumentBuilder<?, ?> builder = SendDocument.builder()
                .chatId(chatId)
                .document(file);
        if (!caption.isBlank()) {
            builder.caption(truncateCaption(caption));
        }
        return client.execute(builder.build());
    }

    private synchronized TelegramClient client() {
        if (telegramClient == null) {
            String token = properties.getChannels().getTelegram().getToken();
            if (token == null || token.isBlank()) {
                throw new DeliveryException(CHANNEL_TYPE, "relay.channels.telegram.token is required for Telegram sends");
            }
            telegramClient = new OkHttpTelegramClient(token.trim());
        }
        return telegramClient;
    }

    static boolean isPhoto(String mediaUrl) {
        String path = mediaUrl;
        int query = path.indexOf('?');
        if (query >= 0) {
            path = path.substring(0, query);
        }
        int dot = path.lastIndexOf('.');
        return dot >= 0 && PHOTO_EXTENSIONS.contains(path.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static InputFile toInputFile(String mediaUrl) {
        String lower = mediaUrl.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new InputFile(mediaUrl);
        }
        String path = lower.startsWith("file://") ? mediaUrl.substring("file://".length()) : mediaUrl;
        return new InputFile(new File(path));
    }

    private static String truncateCaption(String caption) {
        if (caption.length() <= TELEGRAM_MAX_CAPTION_LENGTH) {
            return caption;
        }
        return caption.substring(0, TELEGRAM_MAX_CAPTION_LENGTH - 3) + "...";
    }
}
