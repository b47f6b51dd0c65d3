package me.golemcore.relay.adapter.outbound.channel;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.port.outbound.ChannelPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Sends WhatsApp messages through the local web gateway, which owns the
 * WhatsApp Web session.
 *
 * <p>
 * Calls {@code POST {gatewayUrl}/send} with
 * {@code {to, message, mediaUrl, idempotencyKey}}; the gateway answers with
 * {@code {messageId}}.
 */
@Component
@Slf4j
public class WhatsAppGatewayChannelAdapter implements ChannelPort {

    static final String CHANNEL_TYPE = "whatsapp";
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final RelayProperties properties;

    public WhatsAppGatewayChannelAdapter(OkHttpClient baseHttpClient, ObjectMapper objectMapper,
            RelayProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(properties.getChannels().getWhatsapp().getSendTimeoutMs(), TimeUnit.MILLISECONDS)
                .build();
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public CompletableFuture<SendResult> send(String to, String text, String mediaUrl) {
        return CompletableFuture.supplyAsync(() -> {
            String url = trimTrailingSlash(properties.getChannels().getWhatsapp().getGatewayUrl()) + "/send";
            try {
                String body = objectMapper.writeValueAsString(new GatewaySendRequest(
                        to, text != null ? text : "", mediaUrl, UUID.randomUUID().toString()));
                Request request = new Request.Builder()
                        .url(url)
                        .post(RequestBody.create(body, JSON))
                        .build();

                try (Response response = httpClient.newCall(request).execute()) {
                    ResponseBody responseBody = response.body();
                    String responseStr = responseBody != null ? responseBody.string() : "";
                    if (!response.isSuccessful()) {
                        throw new DeliveryException(CHANNEL_TYPE,
                                "WhatsApp gateway send failed: HTTP " + response.code() + " " + responseStr);
                    }
                    String messageId = parseMessageId(responseStr);
                    log.debug("[WhatsApp] Sent message {} to {}", messageId, to);
                    return new SendResult(messageId, to);
                }
            } catch (IOException e) {
                throw new DeliveryException(CHANNEL_TYPE, "WhatsApp gateway unreachable: " + e.getMessage(), e);
            }
        });
    }

    private String parseMessageId(String responseStr) {
        if (responseStr == null || responseStr.isBlank()) {
            return "unknown";
        }
        try {
            JsonNode root = objectMapper.readTree(responseStr);
            JsonNode id = root.get("messageId");
            return id != null && !id.isNull() ? id.asText() : "unknown";
        } catch (IOException e) {
            log.debug("[WhatsApp] Unparsable gateway response: {}", e.getMessage());
            return "unknown";
        }
    }

    private static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GatewaySendRequest(String to, String message, String mediaUrl, String idempotencyKey) {
    }
}
