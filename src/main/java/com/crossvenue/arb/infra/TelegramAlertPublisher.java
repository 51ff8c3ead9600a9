package com.crossvenue.arb.infra;

import com.crossvenue.arb.config.ArbitrageProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Sends alerts to a Telegram chat through the Bot API. Does nothing unless both
 * {@code arb.infra.telegram-bot-token} and {@code arb.infra.telegram-chat-id} are set.
 */
@Slf4j
@Component
public class TelegramAlertPublisher implements AlertPublisher {

    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String apiUrl;
    private final String botToken;
    private final String chatId;

    public TelegramAlertPublisher(ArbitrageProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper) {
        ArbitrageProperties.Infra infra = properties.getInfra();
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.apiUrl = infra.getTelegramApiUrl();
        this.botToken = infra.getTelegramBotToken();
        this.chatId = infra.getTelegramChatId();
        if (isEnabled()) {
            log.info("Telegram alerts enabled for chat {}", chatId);
        }
    }

    public boolean isEnabled() {
        return botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }

    @Override
    public void publish(Alert alert) {
        if (!isEnabled()) {
            return;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("chat_id", chatId);
        payload.put("text", alert.format());
        payload.put("disable_notification", alert.getSeverity() == AlertSeverity.INFO);

        Request request = new Request.Builder()
                .url(apiUrl + "/bot" + botToken + "/sendMessage")
                .post(RequestBody.create(payload.toString(), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.error("Telegram alert failed: {} {}", response.code(), response.message());
            }
        } catch (IOException e) {
            log.error("Telegram alert failed for '{}': {}", alert.getTitle(), e.getMessage());
        }
    }
}
