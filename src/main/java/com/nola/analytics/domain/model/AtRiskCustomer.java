package com.nola.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Recurring customer who stopped buying.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AtRiskCustomer {

    @JsonProperty("customer_name")
    private String customerName;

    @JsonProperty("phone_number")
    private String phoneNumber;

    private String email;

    @JsonProperty("total_compras")
    private long totalPurchases;

    @JsonProperty("ultima_compra")
    private LocalDateTime lastPurchaseAt;

    @JsonProperty("ltv_total")
    private BigDecimal lifetimeValue;

    @JsonProperty("dias_desde_ultima_compra")
    private int daysSinceLastPurchase;
}
