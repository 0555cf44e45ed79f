package com.nola.analytics.domain.export;

import com.nola.analytics.domain.model.AnalyticsRow;
import com.nola.analytics.domain.model.Dimension;
import com.nola.analytics.domain.model.Metric;
import com.nola.analytics.domain.model.ReportFilters;
import com.opencsv.CSVWriterBuilder;
import com.opencsv.ICSVWriter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

/**
 * Renders analytics rows as a human-readable CSV report.
 *
 * Layout: a metadata block describing how the report was produced, a blank
 * line, then the data with the metric and dimension report labels as column
 * headers. Uses the pt-BR spreadsheet convention: {@code ;} between fields and
 * {@code ,} as decimal separator.
 */
@Component
public class CsvReportWriter {

    public static final char SEPARATOR = ';';
    private static final String LINE_END = "\n";

    public byte[] write(List<AnalyticsRow> rows, Metric metric, Dimension dimension,
                        ReportFilters filters, LocalDate generatedOn) {
        StringWriter out = new StringWriter();
        out.write(header(metric, dimension, filters, generatedOn));

        try (ICSVWriter csv = new CSVWriterBuilder(out)
                .withSeparator(SEPARATOR)
                .withLineEnd(LINE_END)
                .build()) {

            csv.writeNext(new String[]{dimension.getReportLabel(), metric.getReportLabel()}, false);
            for (AnalyticsRow row : rows) {
                csv.writeNext(new String[]{formatLabel(row.getLabel()), formatValue(row.getValue())}, false);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV report", e);
        }

        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    String header(Metric metric, Dimension dimension, ReportFilters filters, LocalDate generatedOn) {
        return "Relatorio Nola Gerado em: " + generatedOn + LINE_END
                + LINE_END
                + "Filtros Aplicados:" + LINE_END
                + "Metrica: " + metric.getReportLabel() + LINE_END
                + "Agrupado Por: " + dimension.getReportLabel() + LINE_END
                + "Loja: " + filters.getStoreName() + LINE_END
                + "Canal: " + filters.getChannelName() + LINE_END
                + "Dia da Semana: " + filters.getWeekdayName() + LINE_END
                + "De: " + filters.dateFromLabel() + LINE_END
                + "Ate: " + filters.dateToLabel() + LINE_END
                + LINE_END;
    }

    static String formatLabel(Object label) {
        return label != null ? label.toString() : "";
    }

    static String formatValue(Number value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short
                || value instanceof BigInteger) {
            return value.toString();
        }
        BigDecimal decimal = value instanceof BigDecimal
                ? (BigDecimal) value
                : new BigDecimal(value.toString());
        return decimal.toPlainString().replace('.', ',');
    }
}
