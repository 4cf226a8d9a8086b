package com.errorengine.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A non-email notification target. The config keys depend on the type: {@code url} (and optional
 * {@code secret}) for webhooks, {@code webhook_url} for Teams, {@code bot_token} and
 * {@code chat_id} for Telegram.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class NotificationChannel {
    private Long id;
    @NotBlank
    private String name;
    @NotNull
    private ChannelType type;
    @Builder.Default
    private Map<String, String> config = new LinkedHashMap<>();
    @Builder.Default
    private boolean active = true;
}
