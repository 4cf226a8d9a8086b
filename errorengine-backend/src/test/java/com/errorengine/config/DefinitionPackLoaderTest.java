package com.errorengine.config;

import com.errorengine.model.ChannelType;
import com.errorengine.model.ConditionOperator;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.RoutingRule;
import com.errorengine.model.SourceType;
import com.errorengine.source.JdbcSourceAdapter;
import com.errorengine.store.InMemoryMonitorStore;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class DefinitionPackLoaderTest {

    private static final String PACK = """
            data_sources:
              - name: orders-db
                db_type: h2
                dsn: "jdbc:h2:mem:orders"
            channels:
              - name: ops-teams
                type: teams
                config:
                  webhook_url: https://teams.local/hook
            queries:
              - data_source: orders-db
                channels: [ops-teams]
                query:
                  name: Blocked orders
                  query_text: SELECT order_id, warehouse FROM orders WHERE state = 'BLOCKED'
                  key_fields: [ORDER_ID]
                  interval_minutes: 15
                  active_days: [MONDAY, TUESDAY]
                  window_start: "08:00"
                  window_end: "18:00"
                  default_recipients: [ops@x.com]
                  reminder_interval_minutes: 120
                rules:
                  - name: EU warehouse
                    priority: 10
                    stop_on_match: true
                    conditions:
                      - field_name: WAREHOUSE
                        operator: startswith
                        value: EU
                    recipients: [eu@x.com]
            """;

    @TempDir
    Path dir;

    private final InMemoryMonitorStore store = new InMemoryMonitorStore();
    private DefinitionPackLoader loader;

    @BeforeEach
    void setUp() {
        ErrorEngineProperties properties = new ErrorEngineProperties();
        properties.getDefinitions().setPath(dir.toString());
        MonitorConfigService configService =
                new MonitorConfigService(store, new DefinitionValidator(), mock(JdbcSourceAdapter.class));
        JsonMapper mapper = JsonMapper.builder()
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .addModule(new JavaTimeModule())
                .build();
        loader = new DefinitionPackLoader(properties, configService, store, mapper);
    }

    @Test
    void loadsDataSourcesChannelsQueriesAndRules() throws IOException {
        Files.writeString(dir.resolve("10-orders.yaml"), PACK);

        assertThat(loader.loadAll()).isEqualTo(1);

        assertThat(store.findChannelByName("ops-teams")).hasValueSatisfying(
                c -> assertThat(c.getType()).isEqualTo(ChannelType.TEAMS));
        MonitoredQuery query = store.findQueryByName("Blocked orders").orElseThrow();
        assertThat(query.getSourceType()).isEqualTo(SourceType.DATABASE);
        assertThat(query.getDataSourceId()).isEqualTo(store.findDataSourceByName("orders-db").orElseThrow().getId());
        assertThat(query.getChannelIds()).containsExactly(store.findChannelByName("ops-teams").orElseThrow().getId());
        assertThat(query.getActiveDays()).containsExactlyInAnyOrder(DayOfWeek.MONDAY, DayOfWeek.TUESDAY);
        assertThat(query.getWindowStart()).isEqualTo(LocalTime.of(8, 0));
        assertThat(query.getReminderIntervalMinutes()).isEqualTo(120);

        List<RoutingRule> rules = store.findRules(query.getId());
        assertThat(rules).singleElement().satisfies(r -> {
            assertThat(r.isStopOnMatch()).isTrue();
            assertThat(r.getConditions().get(0).getOperator()).isEqualTo(ConditionOperator.STARTSWITH);
        });
    }

    @Test
    void reloadingUpdatesInsteadOfDuplicating() throws IOException {
        Files.writeString(dir.resolve("10-orders.yaml"), PACK);
        loader.loadAll();
        Files.writeString(dir.resolve("10-orders.yaml"), PACK.replace("interval_minutes: 15", "interval_minutes: 5"));
        loader.loadAll();

        assertThat(store.findAllQueries()).singleElement()
                .satisfies(q -> assertThat(q.getIntervalMinutes()).isEqualTo(5));
        assertThat(store.findAllDataSources()).hasSize(1);
        assertThat(store.findAllChannels()).hasSize(1);
    }

    @Test
    void invalidFileIsSkippedOthersStillLoad() throws IOException {
        Files.writeString(dir.resolve("00-broken.yaml"), "queries:\n  - data_source: nowhere\n    query:\n      name: Orphan query\n      key_fields: [ID]\n");
        Files.writeString(dir.resolve("10-orders.yml"), PACK);
        Files.writeString(dir.resolve("README.txt"), "not a pack");

        assertThat(loader.loadAll()).isEqualTo(1);
        assertThat(store.findQueryByName("Orphan query")).isEmpty();
        assertThat(store.findQueryByName("Blocked orders")).isPresent();
    }

    @Test
    void missingDirectoryLoadsNothing() {
        ErrorEngineProperties properties = new ErrorEngineProperties();
        properties.getDefinitions().setPath(dir.resolve("absent").toString());
        DefinitionPackLoader absent = new DefinitionPackLoader(properties,
                new MonitorConfigService(store, new DefinitionValidator(), mock(JdbcSourceAdapter.class)),
                store, JsonMapper.builder().build());

        assertThat(absent.loadAll()).isZero();
    }

    @Test
    void emptyFileIsAnEmptyPack() throws IOException {
        Path empty = Files.writeString(dir.resolve("empty.yaml"), "");

        DefinitionPack pack = loader.parse(empty);

        assertThat(pack.getQueries()).isEmpty();
    }
}
