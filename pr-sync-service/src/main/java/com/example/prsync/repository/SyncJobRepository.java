package com.example.prsync.repository;

import com.example.prsync.entity.SyncJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for SyncJob entity.
 */
@Repository
public interface SyncJobRepository extends JpaRepository<SyncJob, Long> {

    List<SyncJob> findByCorrelationIdOrderByIdAsc(String correlationId);
}
