package me.golemcore.relay.adapter.outbound.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.relay.domain.model.DeliveryException;
import me.golemcore.relay.domain.model.SendResult;
import me.golemcore.relay.infrastructure.config.AutoConfiguration;
import me.golemcore.relay.infrastructure.config.RelayProperties;
import me.golemcore.relay.testsupport.http.OkHttpMockEngine;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DiscordChannelAdapterTest {

    private static final String API = "/api/v10";

    @TempDir
    Path tempDir;

    private OkHttpMockEngine httpEngine;
    private ObjectMapper objectMapper;
    private RelayProperties properties;
    private DiscordChannelAdapter adapter;

    @BeforeEach
    void setUp() {
        httpEngine = new OkHttpMockEngine();
        objectMapper = AutoConfiguration.objectMapper();
        properties = new RelayProperties();
        properties.getChannels().getDiscord().setToken("bot-token");
        properties.getChannels().getDiscord().setApiUrl("https://discord.test/api/v10");
        OkHttpClient client = new OkHttpClient.Builder().addInterceptor(httpEngine).build();
        adapter = new DiscordChannelAdapter(client, objectMapper, properties);
    }

    @Test
    void shouldPostTextToChannel() throws Exception {
        httpEngine.enqueueJson(200, "{\"id\":\"m1\",\"channel_id\":\"c1\"}");

        SendResult result = adapter.send("channel:c1", "hello", null).get(5, TimeUnit.SECONDS);

        assertEquals(new SendResult("m1", "c1"), result);
        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertEquals(API + "/channels/c1/messages", request.target());
        assertEquals("Bot bot-token", request.headers().get("Authorization"));
        assertEquals("hello", objectMapper.readTree(request.body()).get("content").asText());
    }

    @Test
    void shouldOpenDirectMessageChannelForUser() throws Exception {
        httpEngine.enqueueJson(200, "{\"id\":\"dm-9\"}");
        httpEngine.enqueueJson(200, "{\"id\":\"m2\",\"channel_id\":\"dm-9\"}");

        SendResult result = adapter.send("user:42", "hi", null).get(5, TimeUnit.SECONDS);

        assertEquals("dm-9", result.chatId());
        OkHttpMockEngine.CapturedRequest dm = httpEngine.takeRequest();
        assertEquals(API + "/users/@me/channels", dm.target());
        assertEquals("42", objectMapper.readTree(dm.body()).get("recipient_id").asText());
        assertEquals(API + "/channels/dm-9/messages", httpEngine.takeRequest().target());
    }

    @Test
    void shouldSplitLongText() throws Exception {
        httpEngine.enqueueJson(200, "{\"id\":\"m1\"}");
        httpEngine.enqueueJson(200, "{\"id\":\"m2\"}");

        SendResult result = adapter.send("c1", "x".repeat(2500), null).get(5, TimeUnit.SECONDS);

        assertEquals("m2", result.messageId());
        assertEquals(2, httpEngine.getRequestCount());
        assertEquals(2000, objectMapper.readTree(httpEngine.takeRequest().body()).get("content").asText().length());
        assertEquals(500, objectMapper.readTree(httpEngine.takeRequest().body()).get("content").asText().length());
    }

    @Test
    void shouldUploadLocalFileAsAttachment() throws Exception {
        Path file = tempDir.resolve("report.txt");
        Files.writeString(file, "report body");
        httpEngine.enqueueJson(200, "{\"id\":\"m3\",\"channel_id\":\"c1\"}");

        adapter.send("c1", "see attached", file.toString()).get(5, TimeUnit.SECONDS);

        OkHttpMockEngine.CapturedRequest request = httpEngine.takeRequest();
        assertTrue(request.contentType().startsWith("multipart/form-data"));
        assertTrue(request.body().contains("filename=\"report.txt\""));
        assertTrue(request.body().contains("report body"));
        assertTrue(request.body().contains("see attached"));
    }

    @Test
    void shouldDownloadRemoteMediaBeforeUpload() throws Exception {
        httpEngine.enqueueBytes(200, new byte[] { 1, 2, 3 }, "image/png");
        httpEngine.enqueueJson(200, "{\"id\":\"m4\",\"channel_id\":\"c1\"}");

        adapter.send("c1", "", "https://cdn.test/images/chart.png").get(5, TimeUnit.SECONDS);

        assertEquals("/images/chart.png", httpEngine.takeRequest().target());
        OkHttpMockEngine.CapturedRequest upload = httpEngine.takeRequest();
        assertTrue(upload.body().contains("filename=\"chart.png\""));
    }

    @Test
    void shouldRequireToken() {
        properties.getChannels().getDiscord().setToken(" ");

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> adapter.send("c1", "hello", null).get(5, TimeUnit.SECONDS));

        assertInstanceOf(DeliveryException.class, exception.getCause());
        assertEquals(0, httpEngine.getRequestCount());
    }

    @Test
    void shouldReportApiErrors() {
        httpEngine.enqueueJson(403, "{\"message\":\"Missing Access\"}");

        ExecutionException exception = assertThrows(ExecutionException.class,
                () -> adapter.send("c1", "hello", null).get(5, TimeUnit.SECONDS));

        assertTrue(exception.getCause().getMessage().startsWith("Discord API error: HTTP 403"));
    }

    @Test
    void shouldParseRecipientForms() {
        assertEquals(new DiscordChannelAdapter.Recipient(true, "1"), DiscordChannelAdapter.parseRecipient("user:1"));
        assertEquals(new DiscordChannelAdapter.Recipient(true, "2"),
                DiscordChannelAdapter.parseRecipient("discord:2"));
        assertEquals(new DiscordChannelAdapter.Recipient(true, "3"), DiscordChannelAdapter.parseRecipient("@3"));
        assertEquals(new DiscordChannelAdapter.Recipient(false, "4"),
                DiscordChannelAdapter.parseRecipient("channel:4"));
        assertEquals(new DiscordChannelAdapter.Recipient(false, "5"), DiscordChannelAdapter.parseRecipient(" 5 "));
        assertThrows(DeliveryException.class, () -> DiscordChannelAdapter.parseRecipient(""));
    }
}
