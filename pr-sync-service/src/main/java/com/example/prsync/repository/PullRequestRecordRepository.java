package com.example.prsync.repository;

import com.example.prsync.entity.PullRequestRecord;
import com.example.prsync.entity.PullRequestState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for PullRequestRecord entity.
 * Extends custom interface for UPSERT operations.
 */
@Repository
public interface PullRequestRecordRepository extends JpaRepository<PullRequestRecord, Long>,
        PullRequestRecordRepositoryCustom {

    Optional<PullRequestRecord> findByRepoOwnerAndRepoNameAndNumber(String repoOwner, String repoName, Integer number);

    List<PullRequestRecord> findByStateOrderByMineDescUpdatedAtDesc(PullRequestState state);

    List<PullRequestRecord> findByStateAndMergedAtGreaterThanEqualOrderByMineDescUpdatedAtDesc(
            PullRequestState state, LocalDateTime mergedSince);
}
