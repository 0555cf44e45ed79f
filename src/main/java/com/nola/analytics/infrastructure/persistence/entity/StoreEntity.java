package com.nola.analytics.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

/**
 * Physical store. Mapped read-only: the table is owned by the operational system.
 */
@Entity
@Immutable
@Table(name = "stores")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoreEntity {

    @Id
    private Integer id;

    @Column(nullable = false)
    private String name;

    @Column(name = "is_active")
    private boolean active;
}
