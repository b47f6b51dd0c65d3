package me.golemcore.relay.adapter.outbound.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.domain.service.TextChunker;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ChannelPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.MultipartBody;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends Discord messages through the REST API (v10) with a bot token.
 *
 * <p>
 * Recipients: {@code user:<id>}, {@code discord:<id>} and {@code @<id>} open a
 * DM channel first; {@code channel:<id>} and a bare id post to that channel.
 * Text longer than {@value #TEXT_LIMIT} characters is split. Media is
 * uploaded as a multipart attachment with the text as caption.
 */
@Component
@Slf4j
public class DiscordChannelAdapter implements ChannelPort {

    static final String CHANNEL_TYPE = "discord";
    static final int TEXT_LIMIT = 2000;
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;

    public DiscordChannelAdapter(OkHttpClient httpClient, ObjectMapper objectMapper, RelayProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public CompletableFuture<SendResult> send(String to, String text, String mediaUrl) {
        return CompletableFuture.supplyAsync(() -> {
            String token = resolveToken();
            Recipient recipient = parseRecipient(to);
            try {
                String channelId = resolveChannelId(token, recipient);
                String body = text != null ? text : "";
                JsonNode message = mediaUrl != null && !mediaUrl.isBlank()
                        ? sendMedia(token, channelId, body, mediaUrl)
                        : sendText(token, channelId, body);
                String messageId = message.hasNonNull("id") ? message.get("id").asText() : "unknown";
                String resultChannel = message.hasNonNull("channel_id") ? message.get("channel_id").asText()
                        : channelId;
                log.debug("[Discord] Sent message {} to channel {}", messageId, resultChannel);
                return new SendResult(messageId, resultChannel);
            } catch (IOException e) {
                throw new DeliveryException(CHANNEL_TYPE, "Discord send failed: " + e.getMessage(), e);
            }
        });
    }

    static Recipient parseRecipient(String raw) {
        String trimmed = raw != null ? raw.trim() : "";
        if (trimmed.isEmpty()) {
            throw new DeliveryException(CHANNEL_TYPE, "Recipient is required for Discord sends");
        }
        if (trimmed.startsWith("user:")) {
            return new Recipient(true, trimmed.substring("user:".length()));
        }
        if (trimmed.startsWith("channel:")) {
            return new Recipient(false, trimmed.substring("channel:".length()));
        }
        if (trimmed.startsWith("discord:")) {
            return new Recipient(true, trimmed.substring("discord:".length()));
        }
        if (trimmed.startsWith("@")) {
            return new Recipient(true, trimmed.substring(1));
        }
        return new Recipient(false, trimmed);
    }

    private String resolveToken() {
        String token = properties.getChannels().getDiscord().getToken();
        if (token == null || token.isBlank()) {
            throw new DeliveryException(CHANNEL_TYPE, "relay.channels.discord.token is required for Discord sends");
        }
        return token.trim();
    }

    private String resolveChannelId(String token, Recipient recipient) throws IOException {
        if (!recipient.user()) {
            return recipient.id();
        }
        String body = objectMapper.writeValueAsString(Map.of("recipient_id", recipient.id()));
        JsonNode dm = execute(token, url("users", "@me", "channels"), RequestBody.create(body, JSON));
        if (!dm.hasNonNull("id")) {
            throw new DeliveryException(CHANNEL_TYPE, "Failed to create Discord DM channel");
        }
        return dm.get("id").asText();
    }

    private JsonNode sendText(String token, String channelId, String text) throws IOException {
        if (text.isBlank()) {
            throw new DeliveryException(CHANNEL_TYPE, "Message must be non-empty for Discord sends");
        }
        List<String> chunks = TextChunker.chunk(text, TEXT_LIMIT);
        JsonNode last = null;
        for (String chunk : chunks) {
            String body = objectMapper.writeValueAsString(Map.of("content", chunk));
            last = execute(token, url("channels", channelId, "messages"), RequestBody.create(body, JSON));
        }
        if (last == null) {
            throw new DeliveryException(CHANNEL_TYPE, "Discord send failed (empty chunk result)");
        }
        return last;
    }

    private JsonNode sendMedia(String token, String channelId, String text, String mediaUrl) throws IOException {
        Media media = loadMedia(mediaUrl);
        String caption = text.length() > TEXT_LIMIT ? text.substring(0, TEXT_LIMIT) : text;
        String payloadJson = caption.isEmpty() ? "{}" : objectMapper.writeValueAsString(Map.of("content", caption));

        RequestBody multipart = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("payload_json", payloadJson)
                .addFormDataPart("files[0]", media.fileName(), RequestBody.create(media.data(), OCTET_STREAM))
                .build();
        JsonNode result = execute(token, url("channels", channelId, "messages"), multipart);

        if (text.length() > TEXT_LIMIT) {
            String remaining = text.substring(TEXT_LIMIT).trim();
            if (!remaining.isEmpty()) {
                sendText(token, channelId, remaining);
            }
        }
        return result;
    }

    private Media loadMedia(String mediaUrl) throws IOException {
        HttpUrl httpUrl = HttpUrl.parse(mediaUrl);
        if (httpUrl != null) {
            Request request = new Request.Builder().url(httpUrl).get().build();
            try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                    throw new IOException("Failed to download media: HTTP " + response.code());
                }
                List<String> segments = httpUrl.pathSegments();
                String name = segments.isEmpty() ? "" : segments.get(segments.size() - 1);
                return new Media(body.bytes(), name.isBlank() ? "upload" : name);
            }
        }
        Path path = Paths.get(mediaUrl.startsWith("file://") ? mediaUrl.substring("file://".length()) : mediaUrl);
        Path fileName = path.getFileName();
        return new Media(Files.readAllBytes(path), fileName != null ? fileName.toString() : "upload");
    }

    private HttpUrl url(String... segments) {
        HttpUrl base = HttpUrl.get(properties.getChannels().getDiscord().getApiUrl());
        HttpUrl.Builder builder = base.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private JsonNode execute(String token, HttpUrl url, RequestBody body) throws IOException {
        Request request = new Request.Builder()
                .url(url)
                .header("Authorization", "Bot " + token)
                .post(body)
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String responseStr = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new DeliveryException(CHANNEL_TYPE,
                        "Discord API error: HTTP " + response.code() + " " + responseStr);
            }
            return responseStr.isBlank() ? objectMapper.createObjectNode() : objectMapper.readTree(responseStr);
        }
    }

    record Recipient(boolean user, String id) {
    }

    private record Media(byte[] data, String fileName) {
    }
}
