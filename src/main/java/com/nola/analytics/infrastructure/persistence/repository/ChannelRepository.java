package com.nola.analytics.infrastructure.persistence.repository;

import com.nola.analytics.infrastructure.persistence.entity.ChannelEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChannelRepository extends JpaRepository<ChannelEntity, Integer> {

    List<ChannelEntity> findAllByOrderByNameAsc();
}
