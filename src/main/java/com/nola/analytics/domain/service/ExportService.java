package com.nola.analytics.domain.service;

import com.nola.analytics.domain.exception.EmptyExportResultException;
import com.nola.analytics.domain.export.CsvReportWriter;
import com.nola.analytics.domain.model.AnalyticsQueryRequest;
import com.nola.analytics.domain.model.AnalyticsRow;
import com.nola.analytics.domain.model.CsvReport;
import com.nola.analytics.domain.model.ReportFilters;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * CSV export of an analytics query.
 *
 * Always runs the full, unlimited query straight against the database: the
 * report must contain every group, not the dashboard's top rows.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExportService {

    static final String EMPTY_RESULT_MESSAGE = "Nenhum dado encontrado para exportar com estes filtros.";

    private final AnalyticsService analyticsService;
    private final FilterService filterService;
    private final CsvReportWriter csvReportWriter;
    private final Clock clock;

    public CsvReport export(AnalyticsQueryRequest request) {
        AnalyticsQueryRequest fullRequest = request.unlimited();

        List<AnalyticsRow> rows = analyticsService.execute(fullRequest);
        if (rows.isEmpty()) {
            throw new EmptyExportResultException(EMPTY_RESULT_MESSAGE);
        }

        ReportFilters filters = filterService.describe(fullRequest.getFilters());
        LocalDate generatedOn = LocalDate.now(clock);

        byte[] content = csvReportWriter.write(
                rows, fullRequest.getMetric(), fullRequest.getDimension(), filters, generatedOn);

        log.info("CSV report generated: metric={}, dimension={}, {} rows",
                fullRequest.getMetric().getToken(), fullRequest.getDimension().getToken(), rows.size());

        return new CsvReport(filenameFor(generatedOn), content);
    }

    static String filenameFor(LocalDate generatedOn) {
        return "relatorio_nola_" + generatedOn + ".csv";
    }
}
