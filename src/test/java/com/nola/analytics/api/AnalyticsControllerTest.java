package com.nola.analytics.api;

import com.nola.analytics.domain.exception.EmptyExportResultException;
import com.nola.analytics.domain.exception.StoreQueryException;
import com.nola.analytics.domain.exception.StoreUnavailableException;
import com.nola.analytics.domain.model.AnalyticsQueryRequest;
import com.nola.analytics.domain.model.AnalyticsRow;
import com.nola.analytics.domain.model.CsvReport;
import com.nola.analytics.domain.model.Dimension;
import com.nola.analytics.domain.model.FilterOption;
import com.nola.analytics.domain.model.Metric;
import com.nola.analytics.domain.model.Weekday;
import com.nola.analytics.domain.service.AnalyticsService;
import com.nola.analytics.domain.service.CustomerSegmentService;
import com.nola.analytics.domain.service.ExportService;
import com.nola.analytics.domain.service.FilterService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.HttpHeaders;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for AnalyticsController.
 *
 * Services are mocked; these cover parameter binding, token validation and the
 * error-to-status mapping.
 */
@WebMvcTest(AnalyticsController.class)
class AnalyticsControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AnalyticsService analyticsService;

    @MockBean
    private ExportService exportService;

    @MockBean
    private FilterService filterService;

    @MockBean
    private CustomerSegmentService customerSegmentService;

    @Test
    void testRoot() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("API de Analytics da Nola está no ar!"));
    }

    @Test
    void testAnalytics_Defaults() throws Exception {
        // Given
        when(analyticsService.query(any())).thenReturn(List.of(
                new AnalyticsRow("Loja Centro", 320),
                new AnalyticsRow("Loja Norte", 210)));

        // When / Then
        mockMvc.perform(get("/api/analytics"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].nome_entidade").value("Loja Centro"))
                .andExpect(jsonPath("$[0].valor_metrica").value(320))
                .andExpect(jsonPath("$[1].valor_metrica").value(210));

        ArgumentCaptor<AnalyticsQueryRequest> captor = ArgumentCaptor.forClass(AnalyticsQueryRequest.class);
        verify(analyticsService).query(captor.capture());
        AnalyticsQueryRequest request = captor.getValue();
        assertEquals(Metric.FATURAMENTO_TOTAL, request.getMetric());
        assertEquals(Dimension.LOJA, request.getDimension());
        assertEquals(50, request.getLimit());
        assertNull(request.getFilters().getStoreId());
    }

    @Test
    void testAnalytics_AllFiltersBound() throws Exception {
        when(analyticsService.query(any())).thenReturn(List.of());

        mockMvc.perform(get("/api/analytics")
                        .param("metric", "total_de_vendas")
                        .param("dimension", "hora_do_dia")
                        .param("channel_id", "2")
                        .param("store_id", "7")
                        .param("dia_semana", "0")
                        .param("date_from", "2024-01-01")
                        .param("date_to", "2024-01-31"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));

        ArgumentCaptor<AnalyticsQueryRequest> captor = ArgumentCaptor.forClass(AnalyticsQueryRequest.class);
        verify(analyticsService).query(captor.capture());
        AnalyticsQueryRequest request = captor.getValue();
        assertEquals(Metric.TOTAL_DE_VENDAS, request.getMetric());
        assertEquals(Dimension.HORA_DO_DIA, request.getDimension());
        assertEquals(2, request.getFilters().getChannelId());
        assertEquals(7, request.getFilters().getStoreId());
        assertEquals(Weekday.DOMINGO, request.getFilters().getWeekday());
        assertEquals(LocalDate.of(2024, 1, 1), request.getFilters().getDateFrom());
        assertEquals(LocalDate.of(2024, 1, 31), request.getFilters().getDateTo());
    }

    @Test
    void testAnalytics_InvalidMetric_NeverReachesServices() throws Exception {
        mockMvc.perform(get("/api/analytics").param("metric", "lucro"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Métrica inválida"));

        verifyNoInteractions(analyticsService);
    }

    @Test
    void testAnalytics_InvalidDimension_NeverReachesServices() throws Exception {
        mockMvc.perform(get("/api/analytics").param("dimension", "s.name; DROP TABLE sales"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Dimensão inválida"));

        verifyNoInteractions(analyticsService);
    }

    @Test
    void testAnalytics_WeekdayOutOfRange() throws Exception {
        mockMvc.perform(get("/api/analytics").param("dia_semana", "7"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Dia da semana inválido"));

        verifyNoInteractions(analyticsService);
    }

    @Test
    void testAnalytics_MalformedParameter() throws Exception {
        mockMvc.perform(get("/api/analytics").param("store_id", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Parâmetro inválido: store_id"));

        verifyNoInteractions(analyticsService);
    }

    @Test
    void testAnalytics_StoreUnavailable() throws Exception {
        when(analyticsService.query(any())).thenThrow(new StoreUnavailableException(new RuntimeException("down")));

        mockMvc.perform(get("/api/analytics"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Não foi possível conectar ao banco de dados"));
    }

    @Test
    void testAnalytics_StoreQueryFailure() throws Exception {
        when(analyticsService.query(any()))
                .thenThrow(new StoreQueryException("canceling statement due to statement timeout", null));

        mockMvc.perform(get("/api/analytics"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("canceling statement due to statement timeout"));
    }

    @Test
    void testExport_Attachment() throws Exception {
        // Given
        byte[] content = "Relatorio Nola Gerado em: 2024-06-15\n".getBytes(StandardCharsets.UTF_8);
        when(exportService.export(any())).thenReturn(new CsvReport("relatorio_nola_2024-06-15.csv", content));

        // When / Then
        mockMvc.perform(get("/api/exportar-csv").param("metric", "ticket_medio").param("dimension", "canal"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.CONTENT_DISPOSITION,
                        containsString("attachment; filename=\"relatorio_nola_2024-06-15.csv\"")))
                .andExpect(content().contentTypeCompatibleWith("text/csv"))
                .andExpect(content().bytes(content));

        ArgumentCaptor<AnalyticsQueryRequest> captor = ArgumentCaptor.forClass(AnalyticsQueryRequest.class);
        verify(exportService).export(captor.capture());
        assertFalse(captor.getValue().isLimited());
        verifyNoInteractions(analyticsService);
    }

    @Test
    void testExport_NoMatchingRows() throws Exception {
        when(exportService.export(any()))
                .thenThrow(new EmptyExportResultException("Nenhum dado encontrado para exportar com estes filtros."));

        mockMvc.perform(get("/api/exportar-csv").param("store_id", "999"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Nenhum dado encontrado para exportar com estes filtros."));
    }

    @Test
    void testExport_InvalidMetric() throws Exception {
        mockMvc.perform(get("/api/exportar-csv").param("metric", "unknown"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(exportService);
    }

    @Test
    void testFilterLists() throws Exception {
        when(filterService.listChannels()).thenReturn(List.of(new FilterOption(1, "iFood")));
        when(filterService.listStores()).thenReturn(List.of(new FilterOption(5, "Loja Centro")));
        when(filterService.listWeekdays()).thenReturn(Weekday.options());

        mockMvc.perform(get("/api/canais"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(1))
                .andExpect(jsonPath("$[0].name").value("iFood"));

        mockMvc.perform(get("/api/lojas"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Loja Centro"));

        mockMvc.perform(get("/api/dias-semana"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(7)))
                .andExpect(jsonPath("$[0].name").value("Domingo"))
                .andExpect(jsonPath("$[6].id").value(6));
    }

    @Test
    void testAtRiskCustomers() throws Exception {
        when(customerSegmentService.atRiskCustomers()).thenReturn(List.of());

        mockMvc.perform(get("/api/clientes-em-risco"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(0)));
    }
}
