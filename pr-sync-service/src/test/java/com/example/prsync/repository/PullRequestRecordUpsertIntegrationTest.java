package com.example.prsync.repository;

import com.example.prsync.config.JpaConfig;
import com.example.prsync.dto.IssueCorrelationDto;
import com.example.prsync.dto.PullRequestDto;
import com.example.prsync.entity.PullRequestRecord;
import com.example.prsync.entity.PullRequestState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Upsert idempotency and board queries against a real PostgreSQL.
 */
@DataJpaTest(properties = {"spring.main.allow-bean-definition-overriding=true"},
        excludeAutoConfiguration = {FlywayAutoConfiguration.class})
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({PullRequestRecordRepositoryImpl.class, JpaConfig.class})
class PullRequestRecordUpsertIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("prsync")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    private static final LocalDateTime T1 = LocalDateTime.of(2026, 3, 10, 9, 0);
    private static final LocalDateTime T2 = LocalDateTime.of(2026, 3, 10, 9, 15);

    @Autowired
    private PullRequestRecordRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    /**
     * Same key twice: one row, fields equal to the second input, last_synced_at advanced.
     */
    @Test
    void upsert_RepeatedSyncReplacesInPlace() {
        PullRequestDto first = pullRequest(42, "alice", "needs review", PullRequestState.OPEN);
        PullRequestDto second = pullRequest(42, "alice", "approved", PullRequestState.OPEN);
        second.setTitle("PROJ-1 Login page (v2)");
        second.setSizeTier(3);

        PullRequestRecord inserted = repository.upsert(first, correlation("PROJ-1", "In Progress"), true, T1);
        PullRequestRecord replaced = repository.upsert(second, correlation("PROJ-1", "In Review"), true, T2);
        entityManager.clear();

        assertThat(replaced.getId()).isEqualTo(inserted.getId());
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM pull_requests", Integer.class);
        assertThat(rows).isEqualTo(1);

        PullRequestRecord stored = repository.findByRepoOwnerAndRepoNameAndNumber("acme", "web", 42).orElseThrow();
        assertThat(stored.getTitle()).isEqualTo("PROJ-1 Login page (v2)");
        assertThat(stored.getReviewStatus()).isEqualTo("approved");
        assertThat(stored.getSizeTier()).isEqualTo(3);
        assertThat(stored.getJiraStatus()).isEqualTo("In Review");
        assertThat(stored.getLastSyncedAt()).isEqualTo(T2);
        assertThat(stored.getCreatedAt()).isNotNull();
    }

    @Test
    void upsert_MineIsRecomputedOnEveryWrite() {
        repository.upsert(pullRequest(1, "Alice", "needs review", PullRequestState.OPEN), null, true, T1);
        assertThat(find(1).isMine()).isTrue();

        repository.upsert(pullRequest(1, "Alice", "needs review", PullRequestState.OPEN), null, false, T2);
        assertThat(find(1).isMine()).isFalse();
    }

    @Test
    void upsert_PersistsJsonColumnsAndCorrelation() {
        PullRequestDto dto = pullRequest(7, "alice", "needs review", PullRequestState.OPEN);
        dto.setRaw(Map.of("number", 7, "size_sparkline", List.of(0.1, 0.2)));
        IssueCorrelationDto correlation = IssueCorrelationDto.builder()
                .jiraKey("PROJ-1")
                .jiraKeys(List.of("PROJ-1", "PROJ-2"))
                .status("In Review")
                .components(List.of("Web"))
                .componentsMatch(true)
                .assignee("Alice Smith")
                .assigneeMatch(null)
                .build();

        repository.upsert(dto, correlation, true, T1);
        entityManager.clear();

        PullRequestRecord stored = find(7);
        assertThat(stored.getRawSnapshot()).containsEntry("number", 7);
        assertThat(stored.getRawSnapshot()).containsEntry("size_sparkline", List.of(0.1, 0.2));
        assertThat(stored.getJiraKeys()).containsExactly("PROJ-1", "PROJ-2");
        assertThat(stored.getJiraComponents()).containsExactly("Web");
        assertThat(stored.getJiraComponentsMatch()).isTrue();
        assertThat(stored.getJiraAssigneeMatch()).isNull();
        assertThat(stored.isLinkedTo("proj-2")).isTrue();
        assertThat(stored.isLinkedTo("PROJ-3")).isFalse();
    }

    @Test
    void upsert_MissingCorrelationClearsJiraFields() {
        repository.upsert(pullRequest(8, "alice", "needs review", PullRequestState.OPEN),
                correlation("PROJ-1", "In Review"), true, T1);
        repository.upsert(pullRequest(8, "alice", "needs review", PullRequestState.OPEN), null, true, T2);
        entityManager.clear();

        PullRequestRecord stored = find(8);
        assertThat(stored.getJiraKey()).isNull();
        assertThat(stored.getJiraKeys()).isEmpty();
        assertThat(stored.getJiraStatus()).isNull();
    }

    @Test
    void boardQueries_OrderMineFirstAndFilterMergedSince() {
        PullRequestDto older = pullRequest(1, "bob", "needs review", PullRequestState.OPEN);
        older.setUpdatedAt(T1.minusDays(1));
        PullRequestDto newer = pullRequest(2, "carol", "needs review", PullRequestState.OPEN);
        newer.setUpdatedAt(T1);
        PullRequestDto mine = pullRequest(3, "alice", "needs review", PullRequestState.OPEN);
        mine.setUpdatedAt(T1.minusDays(5));
        PullRequestDto mergedToday = pullRequest(4, "alice", "approved", PullRequestState.MERGED);
        mergedToday.setMergedAt(LocalDateTime.of(2026, 3, 10, 8, 0));
        PullRequestDto mergedYesterday = pullRequest(5, "alice", "approved", PullRequestState.MERGED);
        mergedYesterday.setMergedAt(LocalDateTime.of(2026, 3, 9, 23, 59));

        for (PullRequestDto dto : List.of(older, newer, mine, mergedToday, mergedYesterday)) {
            repository.upsert(dto, null, "alice".equals(dto.getAuthor()), T2);
        }

        List<PullRequestRecord> open = repository.findByStateOrderByMineDescUpdatedAtDesc(PullRequestState.OPEN);
        List<PullRequestRecord> merged = repository.findByStateAndMergedAtGreaterThanEqualOrderByMineDescUpdatedAtDesc(
                PullRequestState.MERGED, LocalDateTime.of(2026, 3, 10, 0, 0));

        assertThat(open).extracting(PullRequestRecord::getNumber).containsExactly(3, 2, 1);
        assertThat(merged).extracting(PullRequestRecord::getNumber).containsExactly(4);
    }

    private PullRequestRecord find(int number) {
        return repository.findByRepoOwnerAndRepoNameAndNumber("acme", "web", number).orElseThrow();
    }

    private static IssueCorrelationDto correlation(String key, String status) {
        return IssueCorrelationDto.builder()
                .jiraKey(key)
                .jiraKeys(List.of(key))
                .status(status)
                .lastSyncedAt(T1)
                .build();
    }

    private static PullRequestDto pullRequest(int number, String author, String reviewStatus, PullRequestState state) {
        return PullRequestDto.builder()
                .owner("acme")
                .name("web")
                .number(number)
                .title("PROJ-1 Login page")
                .author(author)
                .url("https://github.com/acme/web/pull/" + number)
                .state(state)
                .reviewStatus(reviewStatus)
                .ciSummary("SUCCESS (1 checks)")
                .sizeTier(1)
                .updatedAt(T1)
                .raw(Map.of("number", number))
                .build();
    }
}
