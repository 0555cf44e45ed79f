package com.nola.analytics.domain.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.nola.analytics.domain.model.AtRiskCustomer;
import com.nola.analytics.infrastructure.cache.CacheAsideService;
import com.nola.analytics.infrastructure.persistence.repository.CustomerSegmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Customer segments for retention campaigns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerSegmentService {

    static final String AT_RISK_KEY = "segmentos:clientes_em_risco";

    private static final TypeReference<List<AtRiskCustomer>> CUSTOMERS = new TypeReference<>() {
    };

    private final CustomerSegmentRepository customerSegmentRepository;
    private final CacheAsideService cacheAside;

    @Value("${app.cache.ttl.segments:3600}")
    private long segmentsTtl;

    @Value("${app.segments.at-risk.min-purchases:3}")
    private int minPurchases;

    @Value("${app.segments.at-risk.inactive-days:30}")
    private int inactiveDays;

    /**
     * Recurring customers who have not bought anything recently.
     */
    public List<AtRiskCustomer> atRiskCustomers() {
        return cacheAside.getOrCompute(AT_RISK_KEY, CUSTOMERS, () -> {
            try {
                List<AtRiskCustomer> customers =
                        customerSegmentRepository.findAtRiskCustomers(minPurchases, inactiveDays);
                log.info("At-risk segment computed: {} customers", customers.size());
                return customers;
            } catch (DataAccessException e) {
                log.error("Erro na query de clientes em risco: {}", e.getMessage(), e);
                throw StoreFailures.translate(e);
            }
        }, segmentsTtl);
    }
}
