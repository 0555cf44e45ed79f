package com.nola.analytics.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nola.analytics.domain.model.FilterOption;
import com.nola.analytics.domain.model.FilterSet;
import com.nola.analytics.domain.model.ReportFilters;
import com.nola.analytics.domain.model.Weekday;
import com.nola.analytics.infrastructure.cache.CacheAsideService;
import com.nola.analytics.infrastructure.persistence.entity.ChannelEntity;
import com.nola.analytics.infrastructure.persistence.entity.StoreEntity;
import com.nola.analytics.infrastructure.persistence.repository.ChannelRepository;
import com.nola.analytics.infrastructure.persistence.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Reference data behind the dashboard filters.
 *
 * Lists change far less often than sales, so they use the longer reference TTL.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FilterService {

    static final String CHANNELS_KEY = "filtros:canais";
    static final String STORES_KEY = "filtros:lojas";
    static final String WEEKDAYS_KEY = "filtros:dias_semana";

    private static final TypeReference<List<FilterOption>> OPTIONS = new TypeReference<>() {
    };

    private final ChannelRepository channelRepository;
    private final StoreRepository storeRepository;
    private final CacheAsideService cacheAside;

    @Value("${app.cache.ttl.reference:3600}")
    private long referenceTtl;

    public List<FilterOption> listChannels() {
        return cacheAside.getOrCompute(CHANNELS_KEY, OPTIONS, () -> {
            try {
                return channelRepository.findAllByOrderByNameAsc().stream()
                        .map(c -> new FilterOption(c.getId(), c.getName()))
                        .collect(Collectors.toList());
            } catch (DataAccessException e) {
                log.error("Erro na query de canais: {}", e.getMessage(), e);
                throw StoreFailures.translate(e);
            }
        }, referenceTtl);
    }

    public List<FilterOption> listStores() {
        return cacheAside.getOrCompute(STORES_KEY, OPTIONS, () -> {
            try {
                return storeRepository.findByActiveTrueOrderByNameAsc().stream()
                        .map(s -> new FilterOption(s.getId(), s.getName()))
                        .collect(Collectors.toList());
            } catch (DataAccessException e) {
                log.error("Erro na query de lojas: {}", e.getMessage(), e);
                throw StoreFailures.translate(e);
            }
        }, referenceTtl);
    }

    public List<FilterOption> listWeekdays() {
        return cacheAside.getOrCompute(WEEKDAYS_KEY, OPTIONS, Weekday::options, referenceTtl);
    }

    /**
     * Resolves filter ids to the names printed in report headers.
     *
     * Reads the store directly; an id with no matching row is printed as-is.
     */
    public ReportFilters describe(FilterSet filters) {
        ReportFilters.ReportFiltersBuilder report = ReportFilters.builder()
                .dateFrom(filters.getDateFrom())
                .dateTo(filters.getDateTo());

        try {
            if (filters.getStoreId() != null) {
                report.storeName(storeRepository.findById(filters.getStoreId())
                        .map(StoreEntity::getName)
                        .orElse(String.valueOf(filters.getStoreId())));
            }
            if (filters.getChannelId() != null) {
                report.channelName(channelRepository.findById(filters.getChannelId())
                        .map(ChannelEntity::getName)
                        .orElse(String.valueOf(filters.getChannelId())));
            }
        } catch (DataAccessException e) {
            log.error("Erro ao buscar nomes dos filtros: {}", e.getMessage(), e);
            throw StoreFailures.translate(e);
        }

        if (filters.getWeekday() != null) {
            report.weekdayName(filters.getWeekday().getDisplayName());
        }

        return report.build();
    }
}
