package com.errorengine.config;

import com.errorengine.model.ChannelType;
import com.errorengine.model.ConditionOperator;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.RoutingCondition;
import com.errorengine.model.RoutingRule;
import com.errorengine.model.SourceType;
import com.errorengine.routing.ConditionEvaluator;
import com.errorengine.util.DbTypeNormalizer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Edit-time checks for definitions. Each failure is reported as a {@link ConfigurationException}
 * naming the offending field.
 */
@Component
public class DefinitionValidator {

    static final int MAX_QUERY_LENGTH = 10_000;
    static final int MAX_URL_LENGTH = 2_000;

    private static final Set<String> SUPPORTED_DB_TYPES =
            Set.of("postgres", "mysql", "oracle", "sqlserver", "db2i", "h2", "sqlite");

    private static final Pattern NAME = Pattern.compile("^[\\w\\s\\-]+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern KEY_FIELD = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");
    private static final Pattern EMAIL = Pattern.compile("^[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}$");
    private static final List<Pattern> DANGEROUS_SQL = List.of(
            Pattern.compile(";\\s*(DROP|DELETE|UPDATE|INSERT|ALTER|CREATE|TRUNCATE)\\s+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("--"),
            Pattern.compile("/\\*.*\\*/", Pattern.DOTALL)
    );

    public void validateQuery(MonitoredQuery query) {
        validateName(query.getName());

        List<String> keyFields = query.getKeyFields();
        if (keyFields == null || keyFields.isEmpty()) {
            throw new ConfigurationException("key_fields", "at least one key field is required");
        }
        for (String field : keyFields) {
            if (field == null || !KEY_FIELD.matcher(field).matches()) {
                throw new ConfigurationException("key_fields", "invalid key field: " + field);
            }
        }

        if (query.getIntervalMinutes() < 1 || query.getIntervalMinutes() > 1440) {
            throw new ConfigurationException("interval_minutes", "interval must be between 1 and 1440 minutes");
        }
        if (query.getActiveDays() == null || query.getActiveDays().isEmpty()) {
            throw new ConfigurationException("active_days", "at least one active day is required");
        }
        if ((query.getWindowStart() == null) != (query.getWindowEnd() == null)) {
            throw new ConfigurationException("window_start", "time window needs both start and end");
        }
        if (query.hasTimeWindow() && !query.getWindowStart().isBefore(query.getWindowEnd())) {
            throw new ConfigurationException("window_start", "time window start must be before end");
        }
        if (query.getTimeoutSeconds() != null && query.getTimeoutSeconds() < 1) {
            throw new ConfigurationException("timeout_seconds", "timeout must be at least 1 second");
        }
        if (query.getReminderIntervalMinutes() < 0) {
            throw new ConfigurationException("reminder_interval_minutes", "reminder interval cannot be negative");
        }
        if (query.getReminderMaxCount() < 0) {
            throw new ConfigurationException("reminder_max_count", "reminder count cannot be negative");
        }

        if (query.getSourceType() == null) {
            throw new ConfigurationException("source_type", "source type is required");
        }
        if (query.getSourceType() == SourceType.DATABASE) {
            if (query.getDataSourceId() == null) {
                throw new ConfigurationException("data_source_id", "a data source is required for database queries");
            }
            validateSql(query.getQueryText());
        } else {
            Map<String, Object> config = query.getSourceConfig();
            Object url = config != null ? config.get("url") : null;
            validateUrl("source_config.url", url != null ? url.toString() : null);
        }

        validateEmails("recipients", query.getRecipients());
        validateEmails("default_recipients", query.getDefaultRecipients());
    }

    /**
     * Only single SELECT statements are accepted. The pattern check is a guard against obvious
     * statement stacking, not a full SQL parser.
     */
    public void validateSql(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new ConfigurationException("query_text", "query text is required");
        }
        String trimmed = sql.trim();
        if (trimmed.length() > MAX_QUERY_LENGTH) {
            throw new ConfigurationException("query_text", "query too long (max " + MAX_QUERY_LENGTH + " characters)");
        }
        if (!trimmed.toUpperCase(Locale.ROOT).startsWith("SELECT")) {
            throw new ConfigurationException("query_text", "query must be a SELECT");
        }
        for (Pattern pattern : DANGEROUS_SQL) {
            if (pattern.matcher(trimmed).find()) {
                throw new ConfigurationException("query_text", "query contains a forbidden pattern");
            }
        }
    }

    public void validateRules(List<RoutingRule> rules) {
        if (rules == null) {
            return;
        }
        for (int i = 0; i < rules.size(); i++) {
            validateRule(rules.get(i), "rules[" + i + "]");
        }
    }

    void validateRule(RoutingRule rule, String path) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new ConfigurationException(path + ".name", "rule name is required");
        }
        if (rule.getPriority() < 0 || rule.getPriority() > 1000) {
            throw new ConfigurationException(path + ".priority", "priority must be between 0 and 1000");
        }
        if (rule.getRecipients() == null || rule.getRecipients().isEmpty()) {
            throw new ConfigurationException(path + ".recipients", "at least one recipient is required");
        }
        validateEmails(path + ".recipients", rule.getRecipients());

        List<RoutingCondition> conditions = rule.getConditions() == null ? List.of() : rule.getConditions();
        for (int i = 0; i < conditions.size(); i++) {
            RoutingCondition condition = conditions.get(i);
            String at = path + ".conditions[" + i + "]";
            if (condition.getFieldName() == null || condition.getFieldName().isBlank()) {
                throw new ConfigurationException(at + ".field_name", "field name is required");
            }
            if (condition.getOperator() == null) {
                throw new ConfigurationException(at + ".operator", "operator is required");
            }
            if (condition.getOperator().needsValue() && condition.getValue() == null) {
                throw new ConfigurationException(at + ".value", "operator " + condition.getOperator().getCode() + " needs a value");
            }
            if (condition.getOperator() == ConditionOperator.REGEX || condition.getOperator() == ConditionOperator.NOT_REGEX) {
                Optional<String> error = ConditionEvaluator.patternError(condition.getValue());
                if (error.isPresent()) {
                    throw new ConfigurationException(at + ".value", "invalid regular expression: " + error.get());
                }
            }
        }
    }

    public void validateChannel(NotificationChannel channel) {
        validateName(channel.getName());
        if (channel.getType() == null) {
            throw new ConfigurationException("type", "channel type is required");
        }
        Map<String, String> config = channel.getConfig() == null ? Map.of() : channel.getConfig();
        if (channel.getType() == ChannelType.WEBHOOK) {
            validateUrl("config.url", config.get("url"));
        } else if (channel.getType() == ChannelType.TEAMS) {
            validateUrl("config.webhook_url", config.get("webhook_url"));
        } else {
            requireText("config.bot_token", config.get("bot_token"));
            requireText("config.chat_id", config.get("chat_id"));
        }
    }

    public void validateDataSource(DataSourceDefinition dataSource) {
        validateName(dataSource.getName());
        if (dataSource.getDsn() == null || dataSource.getDsn().isBlank()) {
            throw new ConfigurationException("dsn", "dsn is required");
        }
        if (dataSource.getMaxPoolSize() < 1) {
            throw new ConfigurationException("max_pool_size", "pool size must be at least 1");
        }
        String dbType = DbTypeNormalizer.normalize(dataSource.getDbType());
        if (!dbType.isEmpty() && !SUPPORTED_DB_TYPES.contains(dbType)) {
            throw new ConfigurationException("db_type", "unknown db type: " + dataSource.getDbType());
        }
    }

    void validateName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("name", "name is required");
        }
        String trimmed = name.trim();
        if (trimmed.length() < 3 || trimmed.length() > 100) {
            throw new ConfigurationException("name", "name must be 3 to 100 characters");
        }
        if (!NAME.matcher(trimmed).matches()) {
            throw new ConfigurationException("name", "name contains invalid characters");
        }
    }

    void validateEmails(String field, List<String> emails) {
        if (emails == null) {
            return;
        }
        for (String email : emails) {
            if (email == null || email.length() > 254 || !EMAIL.matcher(email.trim()).matches()) {
                throw new ConfigurationException(field, "invalid e-mail address: " + email);
            }
        }
    }

    private static void validateUrl(String field, String url) {
        if (url == null || url.isBlank()) {
            throw new ConfigurationException(field, "url is required");
        }
        String trimmed = url.trim();
        if (!trimmed.startsWith("http://") && !trimmed.startsWith("https://")) {
            throw new ConfigurationException(field, "url must start with http:// or https://");
        }
        if (trimmed.length() > MAX_URL_LENGTH) {
            throw new ConfigurationException(field, "url too long (max " + MAX_URL_LENGTH + " characters)");
        }
    }

    private static void requireText(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(field, field + " is required");
        }
    }
}
