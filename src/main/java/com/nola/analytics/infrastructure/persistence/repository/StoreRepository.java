package com.nola.analytics.infrastructure.persistence.repository;

import com.nola.analytics.infrastructure.persistence.entity.StoreEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StoreRepository extends JpaRepository<StoreEntity, Integer> {

    List<StoreEntity> findByActiveTrueOrderByNameAsc();
}
