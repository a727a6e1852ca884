package com.example.prsync.repository;

import com.example.prsync.dto.IssueCorrelationDto;
import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.entity.PullRequestRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Implementation of custom UPSERT operations for PullRequestRecord.
 *
 * Look-up-then-write inside one transaction. A concurrent insert of the same key fails on
 * uk_pull_requests_repo_number instead of creating a second row; the next pass overwrites it.
 */
@Repository
@Slf4j
public class PullRequestRecordRepositoryImpl implements PullRequestRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    @Transactional
    public PullRequestRecord upsert(PullRequestDto pullRequest,
                                    IssueCorrelationDto correlation,
                                    boolean mine,
                                    LocalDateTime syncedAt) {
        List<PullRequestRecord> existing = entityManager.createQuery("""
                        SELECT p FROM PullRequestRecord p
                        WHERE p.repoOwner = :owner AND p.repoName = :name AND p.number = :number
                        """, PullRequestRecord.class)
                .setParameter("owner", pullRequest.getOwner())
                .setParameter("name", pullRequest.getName())
                .setParameter("number", pullRequest.getNumber())
                .getResultList();

        PullRequestRecord record;
        if (existing.isEmpty()) {
            record = PullRequestRecord.builder()
                    .repoOwner(pullRequest.getOwner())
                    .repoName(pullRequest.getName())
                    .number(pullRequest.getNumber())
                    .build();
        } else {
            record = existing.get(0);
        }

        applyRemoteFields(record, pullRequest, mine);
        applyCorrelation(record, correlation);
        record.setLastSyncedAt(syncedAt);

        if (record.getId() == null) {
            entityManager.persist(record);
            log.debug("Inserted pull request {}/{}#{}", record.getRepoOwner(), record.getRepoName(), record.getNumber());
        } else {
            log.debug("Replaced pull request {}/{}#{}", record.getRepoOwner(), record.getRepoName(), record.getNumber());
        }
        entityManager.flush();
        return record;
    }

    private void applyRemoteFields(PullRequestRecord record, PullRequestDto pullRequest, boolean mine) {
        record.setTitle(pullRequest.getTitle());
        record.setAuthor(pullRequest.getAuthor());
        record.setUrl(pullRequest.getUrl());
        record.setState(pullRequest.getState());
        record.setDraft(pullRequest.isDraft());
        record.setReviewStatus(pullRequest.getReviewStatus());
        record.setCiSummary(pullRequest.getCiSummary());
        record.setMergeCiSummary(pullRequest.getMergeCiSummary());
        record.setLastCommitSha(pullRequest.getLastCommitSha());
        record.setMergeCommitSha(pullRequest.getMergeCommitSha());
        record.setHasConflicts(pullRequest.isHasConflicts());
        record.setSizeTier(pullRequest.getSizeTier());
        record.setUpdatedAt(pullRequest.getUpdatedAt());
        record.setMergedAt(pullRequest.getMergedAt());
        record.setRawSnapshot(pullRequest.getRaw() != null ? new LinkedHashMap<>(pullRequest.getRaw()) : null);
        record.setMine(mine);
    }

    private void applyCorrelation(PullRequestRecord record, IssueCorrelationDto correlation) {
        IssueCorrelationDto source = correlation != null ? correlation : IssueCorrelationDto.keysOnly(List.of());
        record.setJiraKey(source.getJiraKey());
        record.setJiraKeys(source.getJiraKeys() != null ? new ArrayList<>(source.getJiraKeys()) : new ArrayList<>());
        record.setJiraStatus(source.getStatus());
        record.setJiraSummary(source.getSummary());
        record.setJiraUrl(source.getUrl());
        record.setJiraLastSyncedAt(source.getLastSyncedAt());
        record.setJiraComponents(source.getComponents() != null ? new ArrayList<>(source.getComponents()) : new ArrayList<>());
        record.setJiraComponentsMatch(source.getComponentsMatch());
        record.setJiraAssignee(source.getAssignee());
        record.setJiraAssigneeMatch(source.getAssigneeMatch());
    }
}
