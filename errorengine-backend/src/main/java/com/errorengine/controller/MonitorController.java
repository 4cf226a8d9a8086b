package com.errorengine.controller;

import com.errorengine.api.FieldInfo;
import com.errorengine.api.QueryStatusResponse;
import com.errorengine.api.SourceTestResponse;
import com.errorengine.config.MonitorConfigService;
import com.errorengine.model.ActiveError;
import com.errorengine.model.DataSourceDefinition;
import com.errorengine.model.ExecutionLog;
import com.errorengine.model.MonitoredQuery;
import com.errorengine.model.NotificationChannel;
import com.errorengine.model.RoutingRule;
import com.errorengine.monitor.ExecutionResult;
import com.errorengine.monitor.MonitorOrchestrator;
import com.errorengine.monitor.NextScheduledRun;
import com.errorengine.source.SourceException;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1")
public class MonitorController {

    private static final Logger log = LoggerFactory.getLogger(MonitorController.class);

    private final MonitorOrchestrator orchestrator;
    private final MonitorConfigService configService;

    public MonitorController(MonitorOrchestrator orchestrator, MonitorConfigService configService) {
        this.orchestrator = orchestrator;
        this.configService = configService;
    }

    /**
     * Run a query now, ignoring its schedule.
     *
     * POST /v1/queries/{id}/run
     *
     * @param id query id
     * @return execution result; status SKIPPED when the query is already running
     */
    @PostMapping("/queries/{id}/run")
    public ExecutionResult runNow(@PathVariable("id") long id) {
        return orchestrator.runNow(id);
    }

    /**
     * POST /v1/errors/{id}/resolve
     */
    @PostMapping("/errors/{id}/resolve")
    public ActiveError resolve(@PathVariable("id") long id) {
        return orchestrator.resolveManually(id);
    }

    /**
     * GET /v1/errors?query_id=
     */
    @GetMapping("/errors")
    public List<ActiveError> activeErrors(@RequestParam(name = "query_id", required = false) Long queryId) {
        return orchestrator.listActiveErrors(queryId);
    }

    /**
     * Next query due to run.
     *
     * GET /v1/schedule/next
     *
     * @return the next run, or 204 when no active query will run
     */
    @GetMapping("/schedule/next")
    public ResponseEntity<NextScheduledRun> nextRun() {
        return orchestrator.getNextScheduledRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/queries")
    public List<MonitoredQuery> queries() {
        return configService.listQueries();
    }

    /**
     * Create or update a query. Without an id, a query with the same name is updated.
     *
     * PUT /v1/queries
     */
    @PutMapping("/queries")
    public MonitoredQuery saveQuery(@Valid @RequestBody MonitoredQuery query) {
        return configService.saveQuery(query);
    }

    @GetMapping("/queries/{id}/status")
    public QueryStatusResponse status(@PathVariable("id") long id) {
        return orchestrator.queryStatus(id);
    }

    @GetMapping("/queries/{id}/logs")
    public List<ExecutionLog> logs(@PathVariable("id") long id,
                                   @RequestParam(name = "limit", defaultValue = "50") int limit) {
        return orchestrator.executionLogs(id, limit);
    }

    /**
     * Fetch the query's rows without touching its errors.
     *
     * POST /v1/queries/{id}/test
     */
    @PostMapping("/queries/{id}/test")
    public SourceTestResponse test(@PathVariable("id") long id) {
        SourceTestResponse response = orchestrator.testSource(id);
        log.info("Source test: query_id={}, success={}, rows={}", id, response.isSuccess(), response.getRowCount());
        return response;
    }

    @GetMapping("/queries/{id}/fields")
    public List<FieldInfo> fields(@PathVariable("id") long id) throws SourceException {
        return orchestrator.availableFields(id);
    }

    @GetMapping("/queries/{id}/rules")
    public List<RoutingRule> rules(@PathVariable("id") long id) {
        return configService.getRules(id);
    }

    /**
     * Replace all routing rules of a query.
     *
     * PUT /v1/queries/{id}/rules
     */
    @PutMapping("/queries/{id}/rules")
    public List<RoutingRule> replaceRules(@PathVariable("id") long id, @RequestBody List<RoutingRule> rules) {
        return configService.replaceRules(id, rules);
    }

    @GetMapping("/data-sources")
    public List<DataSourceDefinition> dataSources() {
        return configService.listDataSources();
    }

    @PutMapping("/data-sources")
    public DataSourceDefinition saveDataSource(@Valid @RequestBody DataSourceDefinition dataSource) {
        return configService.saveDataSource(dataSource);
    }

    /**
     * POST /v1/data-sources/{id}/test
     */
    @PostMapping("/data-sources/{id}/test")
    public SourceTestResponse testDataSource(@PathVariable("id") long id) {
        return configService.testDataSource(id);
    }

    @GetMapping("/channels")
    public List<NotificationChannel> channels() {
        return configService.listChannels();
    }

    @PutMapping("/channels")
    public NotificationChannel saveChannel(@Valid @RequestBody NotificationChannel channel) {
        return configService.saveChannel(channel);
    }
}
