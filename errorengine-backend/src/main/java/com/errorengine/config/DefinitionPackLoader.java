package com.errorengine.config;

import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.SourceType;
import com.errorengine.store.MonitorStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Loads definition packs (*.yaml / *.yml) from the configured directory at startup. Files are applied
 * in name order; entries are upserted by name through {@link MonitorConfigService}, so they go through
 * the same validation as API edits. A file that fails to parse or validate is logged and skipped.
 */
@Component
public class DefinitionPackLoader {

    private static final Logger log = LoggerFactory.getLogger(DefinitionPackLoader.class);

    private final ErrorEngineProperties properties;
    private final MonitorConfigService configService;
    private final MonitorStore store;
    private final ObjectMapper objectMapper;

    public DefinitionPackLoader(ErrorEngineProperties properties, MonitorConfigService configService,
                                MonitorStore store, ObjectMapper objectMapper) {
        this.properties = properties;
        this.configService = configService;
        this.store = store;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void loadAtStartup() {
        loadAll();
    }

    /**
     * @return number of files applied without error
     */
    public int loadAll() {
        Path dir = Paths.get(properties.getDefinitions().getPath());
        if (!Files.isDirectory(dir)) {
            log.info("Definitions directory not found, nothing to load: path={}", dir.toAbsolutePath());
            return 0;
        }

        List<Path> files;
        try (Stream<Path> listing = Files.list(dir)) {
            files = listing
                    .filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list definitions directory: path={}", dir, e);
            return 0;
        }

        int applied = 0;
        for (Path file : files) {
            try {
                apply(parse(file));
                applied++;
                log.info("Loaded definition pack: file={}", file.getFileName());
            } catch (Exception e) {
                log.error("Skipping definition pack: file={}, error={}", file.getFileName(), e.getMessage(), e);
            }
        }
        return applied;
    }

    DefinitionPack parse(Path file) throws IOException {
        Object raw;
        try (InputStream in = Files.newInputStream(file)) {
            raw = new Yaml().load(in);
        }
        if (raw == null) {
            return new DefinitionPack();
        }
        return objectMapper.convertValue(raw, DefinitionPack.class);
    }

    void apply(DefinitionPack pack) {
        for (DataSourceDefinition dataSource : nonNull(pack.getDataSources())) {
            configService.saveDataSource(dataSource);
        }
        for (NotificationChannel channel : nonNull(pack.getChannels())) {
            configService.saveChannel(channel);
        }
        for (DefinitionPack.QueryEntry entry : nonNull(pack.getQueries())) {
            applyQuery(entry);
        }
    }

    private void applyQuery(DefinitionPack.QueryEntry entry) {
        if (entry.getQuery() == null) {
            throw new ConfigurationException("query", "query entry without a query");
        }
        MonitoredQuery.MonitoredQueryBuilder query = entry.getQuery().toBuilder().id(null);

        if (entry.getDataSource() != null) {
            DataSourceDefinition dataSource = store.findDataSourceByName(entry.getDataSource())
                    .orElseThrow(() -> new ConfigurationException("data_source", "unknown data source: " + entry.getDataSource()));
            query.sourceType(SourceType.DATABASE).dataSourceId(dataSource.getId());
        }

        List<Long> channelIds = new ArrayList<>();
        for (String name : nonNull(entry.getChannels())) {
            NotificationChannel channel = store.findChannelByName(name)
                    .orElseThrow(() -> new ConfigurationException("channels", "unknown channel: " + name));
            channelIds.add(channel.getId());
        }
        if (!channelIds.isEmpty()) {
            query.channelIds(channelIds);
        }

        MonitoredQuery saved = configService.saveQuery(query.build());
        if (entry.getRules() != null) {
            configService.replaceRules(saved.getId(), entry.getRules());
        }
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
