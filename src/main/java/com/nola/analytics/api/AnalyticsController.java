package com.nola.analytics.api;

import com.nola.analytics.domain.model.AnalyticsQueryRequest;
import com.nola.analytics.domain.model.AnalyticsRow;
import com.nola.analytics.domain.model.AtRiskCustomer;
import com.nola.analytics.domain.model.CsvReport;
import com.nola.analytics.domain.model.Dimension;
import com.nola.analytics.domain.model.FilterOption;
import com.nola.analytics.domain.model.FilterSet;
import com.nola.analytics.domain.model.Metric;
import com.nola.analytics.domain.model.Weekday;
import com.nola.analytics.domain.service.AnalyticsService;
import com.nola.analytics.domain.service.CustomerSegmentService;
import com.nola.analytics.domain.service.ExportService;
import com.nola.analytics.domain.service.FilterService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * REST API for the sales dashboard.
 *
 * Endpoints:
 * - GET /                      - Liveness message
 * - GET /api/canais            - Channels filter list
 * - GET /api/lojas             - Active stores filter list
 * - GET /api/dias-semana       - Weekdays filter list
 * - GET /api/analytics         - Grouped aggregation (top rows, cached)
 * - GET /api/exportar-csv      - Full aggregation as CSV attachment
 * - GET /api/clientes-em-risco - At-risk customers segment
 *
 * Metric and dimension tokens are resolved here, so an unknown token is
 * rejected before the cache or the database is touched.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class AnalyticsController {

    static final String DEFAULT_METRIC = "faturamento_total";
    static final String DEFAULT_DIMENSION = "loja";

    private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final AnalyticsService analyticsService;
    private final ExportService exportService;
    private final FilterService filterService;
    private final CustomerSegmentService customerSegmentService;

    @Value("${app.analytics.row-limit:50}")
    private int rowLimit;

    @GetMapping("/")
    public ResponseEntity<Map<String, String>> root() {
        return ResponseEntity.ok(Map.of("message", "API de Analytics da Nola está no ar!"));
    }

    @GetMapping("/api/canais")
    public ResponseEntity<List<FilterOption>> channels() {
        return ResponseEntity.ok(filterService.listChannels());
    }

    @GetMapping("/api/lojas")
    public ResponseEntity<List<FilterOption>> stores() {
        return ResponseEntity.ok(filterService.listStores());
    }

    @GetMapping("/api/dias-semana")
    public ResponseEntity<List<FilterOption>> weekdays() {
        return ResponseEntity.ok(filterService.listWeekdays());
    }

    /**
     * Grouped aggregation for the dashboard charts.
     *
     * GET /api/analytics?metric=faturamento_total&dimension=loja&channel_id=1&date_from=2024-01-01
     *
     * Returns at most {@code app.analytics.row-limit} rows ordered by value, highest first.
     */
    @GetMapping("/api/analytics")
    public ResponseEntity<List<AnalyticsRow>> analytics(
            @RequestParam(defaultValue = DEFAULT_METRIC) String metric,
            @RequestParam(defaultValue = DEFAULT_DIMENSION) String dimension,
            @RequestParam(name = "channel_id", required = false) Integer channelId,
            @RequestParam(name = "store_id", required = false) Integer storeId,
            @RequestParam(name = "dia_semana", required = false) Integer diaSemana,
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {

        log.info("Analytics query: metric={}, dimension={}, channel={}, store={}, weekday={}, from={}, to={}",
                metric, dimension, channelId, storeId, diaSemana, dateFrom, dateTo);

        AnalyticsQueryRequest request = toRequest(metric, dimension, channelId, storeId, diaSemana, dateFrom, dateTo)
                .toBuilder()
                .limit(rowLimit)
                .build();

        return ResponseEntity.ok(analyticsService.query(request));
    }

    /**
     * Same query as {@link #analytics} without the row limit, as a CSV download.
     *
     * Responds 404 when no row matches the filters.
     */
    @GetMapping("/api/exportar-csv")
    public ResponseEntity<byte[]> exportCsv(
            @RequestParam(defaultValue = DEFAULT_METRIC) String metric,
            @RequestParam(defaultValue = DEFAULT_DIMENSION) String dimension,
            @RequestParam(name = "channel_id", required = false) Integer channelId,
            @RequestParam(name = "store_id", required = false) Integer storeId,
            @RequestParam(name = "dia_semana", required = false) Integer diaSemana,
            @RequestParam(name = "date_from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(name = "date_to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {

        log.info("CSV export: metric={}, dimension={}, channel={}, store={}, weekday={}, from={}, to={}",
                metric, dimension, channelId, storeId, diaSemana, dateFrom, dateTo);

        CsvReport report = exportService.export(
                toRequest(metric, dimension, channelId, storeId, diaSemana, dateFrom, dateTo));

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(report.getFilename()).build().toString())
                .contentType(TEXT_CSV)
                .body(report.getContent());
    }

    @GetMapping("/api/clientes-em-risco")
    public ResponseEntity<List<AtRiskCustomer>> atRiskCustomers() {
        return ResponseEntity.ok(customerSegmentService.atRiskCustomers());
    }

    private static AnalyticsQueryRequest toRequest(String metric, String dimension, Integer channelId,
                                                   Integer storeId, Integer diaSemana,
                                                   LocalDate dateFrom, LocalDate dateTo) {
        return AnalyticsQueryRequest.builder()
                .metric(Metric.fromToken(metric))
                .dimension(Dimension.fromToken(dimension))
                .filters(FilterSet.builder()
                        .channelId(channelId)
                        .storeId(storeId)
                        .weekday(diaSemana != null ? Weekday.fromIndex(diaSemana) : null)
                        .dateFrom(dateFrom)
                        .dateTo(dateTo)
                        .build())
                .build();
    }
}
