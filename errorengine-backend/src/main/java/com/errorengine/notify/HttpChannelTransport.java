package com.errorengine.notify;

import com.errorengine.config.ErrorEngineProperties;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.NotificationKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Posts JSON notifications to webhook, Microsoft Teams and Telegram channels.
 */
@Slf4j
@Component
public class HttpChannelTransport implements NotificationTransport {

    private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm");

    private final ObjectMapper objectMapper;
    private final ErrorEngineProperties properties;
    private final Clock clock;
    private final HttpClient httpClient;

    public HttpChannelTransport(ObjectMapper objectMapper, ErrorEngineProperties properties, Clock clock) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getSource().getConnectTimeoutSeconds()))
                .build();
    }

    @Override
    public boolean supports(Destination destination) {
        return destination.getKind() == Destination.Kind.CHANNEL;
    }

    @Override
    public DeliveryResult deliver(Destination destination, NotificationKind kind, List<ErrorContext> errors, MonitoredQuery query)
            throws IOException, InterruptedException {
        NotificationChannel channel = destination.getChannel();
        Map<String, String> config = channel.getConfig() != null ? channel.getConfig() : Map.of();

        return switch (channel.getType()) {
            case WEBHOOK -> {
                String url = config.get("url");
                if (url == null || url.isBlank()) {
                    yield DeliveryResult.failure("webhook url not configured");
                }
                HttpResponse<String> response = post(url, webhookPayload(kind, query, errors), config.get("secret"));
                yield statusResult(response);
            }
            case TEAMS -> {
                String url = config.get("webhook_url");
                if (url == null || url.isBlank()) {
                    yield DeliveryResult.failure("teams webhook_url not configured");
                }
                yield statusResult(post(url, teamsPayload(kind, query, errors), null));
            }
            case TELEGRAM -> {
                String token = config.get("bot_token");
                String chatId = config.get("chat_id");
                if (token == null || token.isBlank() || chatId == null || chatId.isBlank()) {
                    yield DeliveryResult.failure("telegram bot_token or chat_id not configured");
                }
                String url = properties.getNotify().getTelegramApiUrl() + "/bot" + token + "/sendMessage";
                yield telegramResult(post(url, telegramPayload(chatId, kind, query, errors), null));
            }
        };
    }

    Map<String, Object> webhookPayload(NotificationKind kind, MonitoredQuery query, List<ErrorContext> errors) {
        Map<String, Object> queryInfo = new LinkedHashMap<>();
        queryInfo.put("id", query.getId());
        queryInfo.put("name", query.getName());
        queryInfo.put("description", query.getDescription());

        List<Map<String, Object>> rows = new ArrayList<>();
        for (ErrorContext e : limited(errors)) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("error_id", e.getErrorId());
            item.put("signature", e.getSignature() != null ? e.getSignature().getValues() : List.of());
            item.put("first_seen_at", String.valueOf(e.getFirstSeenAt()));
            item.put("occurrence_count", e.getOccurrenceCount());
            item.put("row", e.getRow());
            rows.add(item);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", kind == NotificationKind.REMINDER ? "errors_reminder" : "errors_detected");
        payload.put("timestamp", clock.instant().toString());
        payload.put("query", queryInfo);
        payload.put("errors_count", errors.size());
        payload.put("errors", rows);
        return payload;
    }

    Map<String, Object> teamsPayload(NotificationKind kind, MonitoredQuery query, List<ErrorContext> errors) {
        List<Map<String, Object>> facts = new ArrayList<>();
        facts.add(fact("Errors", String.valueOf(errors.size())));
        facts.add(fact("Date", displayNow()));
        for (int i = 0; i < Math.min(3, errors.size()); i++) {
            facts.add(fact("Error " + (i + 1), NotificationMessages.preview(errors.get(i).getRow(), 60)));
        }

        Map<String, Object> section = new LinkedHashMap<>();
        section.put("activityTitle", query.getName());
        section.put("activitySubtitle", kind == NotificationKind.REMINDER ? "Errors still open" : "New errors detected");
        section.put("facts", facts);
        section.put("markdown", true);

        Map<String, Object> card = new LinkedHashMap<>();
        card.put("@type", "MessageCard");
        card.put("@context", "http://schema.org/extensions");
        card.put("themeColor", "d63384");
        card.put("summary", "ErrorEngine: " + errors.size() + " errors");
        card.put("sections", List.of(section));
        return card;
    }

    Map<String, Object> telegramPayload(String chatId, NotificationKind kind, MonitoredQuery query, List<ErrorContext> errors) {
        List<String> lines = new ArrayList<>();
        lines.add(kind == NotificationKind.REMINDER ? "<b>ErrorEngine reminder</b>" : "<b>ErrorEngine</b>");
        lines.add("");
        lines.add("<b>Query:</b> " + escapeHtml(query.getName()));
        lines.add("<b>Errors:</b> " + errors.size());
        lines.add("<b>Date:</b> " + displayNow());
        if (!errors.isEmpty()) {
            lines.add("");
            lines.add("<b>Details:</b>");
            for (ErrorContext e : errors.subList(0, Math.min(5, errors.size()))) {
                lines.add("• " + escapeHtml(NotificationMessages.preview(e.getRow(), 80)));
            }
            if (errors.size() > 5) {
                lines.add("<i>...and " + (errors.size() - 5) + " more</i>");
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("chat_id", chatId);
        payload.put("text", String.join("\n", lines));
        payload.put("parse_mode", "HTML");
        payload.put("disable_web_page_preview", true);
        return payload;
    }

    private HttpResponse<String> post(String url, Map<String, Object> payload, String secret)
            throws IOException, InterruptedException {
        String json = objectMapper.writeValueAsString(payload);
        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(properties.getNotify().getHttpTimeoutSeconds()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8));
        if (secret != null && !secret.isBlank()) {
            request.header("X-ErrorEngine-Secret", secret);
        }
        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static DeliveryResult statusResult(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return DeliveryResult.success("OK (" + status + ")");
        }
        return DeliveryResult.failure("HTTP " + status);
    }

    private DeliveryResult telegramResult(HttpResponse<String> response) throws IOException {
        JsonNode root = objectMapper.readTree(response.body());
        if (root != null && root.path("ok").asBoolean(false)) {
            return DeliveryResult.success("sent");
        }
        String description = root != null ? root.path("description").asText("telegram error") : "telegram error";
        return DeliveryResult.failure(description);
    }

    private List<ErrorContext> limited(List<ErrorContext> errors) {
        int max = properties.getNotify().getMaxErrorsPerMessage();
        return errors.size() <= max ? errors : errors.subList(0, max);
    }

    private String displayNow() {
        return ZonedDateTime.now(clock.withZone(properties.zoneId())).format(DISPLAY_TIME);
    }

    private static Map<String, Object> fact(String name, String value) {
        Map<String, Object> fact = new LinkedHashMap<>();
        fact.put("name", name);
        fact.put("value", value);
        return fact;
    }

    private static String escapeHtml(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
