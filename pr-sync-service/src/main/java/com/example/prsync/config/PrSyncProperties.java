package com.example.prsync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable configuration for the reconciliation core.
 * Bound from the {@code prsync.*} namespace and handed to components by constructor injection.
 */
@ConfigurationProperties(prefix = "prsync")
public record PrSyncProperties(Github github,
                               Jira jira,
                               Poll poll,
                               Http http) {

    public PrSyncProperties {
        github = github != null ? github : new Github(null, null, null, 0);
        jira = jira != null ? jira : new Jira(null, null, null, null, null, null, null, null);
        poll = poll != null ? poll : new Poll(null, null, null);
        http = http != null ? http : new Http(null);
    }

    public record Github(String apiUrl,
                         String token,
                         String username,
                         int pageSize) {

        public Github {
            apiUrl = apiUrl != null ? apiUrl : "https://api.github.com/graphql";
            pageSize = pageSize > 0 ? pageSize : 20;
        }
    }

    public record Jira(String baseUrl,
                       String email,
                       String apiToken,
                       String username,
                       List<String> allowedKeyPrefixes,
                       Map<String, String> componentRepoMap,
                       Map<String, List<String>> laneStatuses,
                       String transitionPathsFile) {

        public Jira {
            allowedKeyPrefixes = allowedKeyPrefixes != null ? List.copyOf(allowedKeyPrefixes) : List.of();
            componentRepoMap = componentRepoMap != null ? Map.copyOf(componentRepoMap) : Map.of();
            laneStatuses = laneStatuses != null ? Map.copyOf(laneStatuses) : Map.of();
        }

        public boolean enabled() {
            return hasText(baseUrl) && hasText(email) && hasText(apiToken);
        }

        public String browseUrl(String issueKey) {
            return stripTrailingSlash(baseUrl) + "/browse/" + issueKey;
        }

        /**
         * Target statuses for a lane status group (e.g. "needs-review", "draft", "merged").
         * Missing groups yield an empty list, meaning no transition is possible.
         */
        public List<String> statusesFor(String group) {
            List<String> statuses = laneStatuses.get(group);
            return statuses != null ? List.copyOf(statuses) : List.of();
        }
    }

    public record Poll(Duration interval,
                       List<String> trackedRepos,
                       List<String> watchedPrs) {

        public Poll {
            interval = interval != null ? interval : Duration.ofSeconds(15);
            trackedRepos = trackedRepos != null ? List.copyOf(trackedRepos) : List.of();
            watchedPrs = watchedPrs != null ? List.copyOf(watchedPrs) : List.of();
        }
    }

    public record Http(Duration timeout) {

        public Http {
            timeout = timeout != null ? timeout : Duration.ofSeconds(8);
        }
    }

    public record RepoRef(String owner, String name) {

        @Override
        public String toString() {
            return owner + "/" + name;
        }
    }

    public record WatchedPr(String owner, String name, int number) {

        @Override
        public String toString() {
            return owner + "/" + name + "#" + number;
        }
    }

    /**
     * Parse "owner/name" entries. Blank entries are skipped.
     */
    public List<RepoRef> repoList() {
        List<RepoRef> repos = new ArrayList<>();
        for (String item : poll.trackedRepos()) {
            String trimmed = item == null ? "" : item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] parts = trimmed.split("/", 2);
            if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
                throw new IllegalArgumentException("Invalid tracked repo (expected owner/name): " + item);
            }
            repos.add(new RepoRef(parts[0].trim(), parts[1].trim()));
        }
        return repos;
    }

    /**
     * Parse "owner/name#123" entries. Blank entries are skipped.
     */
    public List<WatchedPr> watchedPrList() {
        List<WatchedPr> prs = new ArrayList<>();
        for (String item : poll.watchedPrs()) {
            String trimmed = item == null ? "" : item.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] repoAndNumber = trimmed.split("#", 2);
            String[] parts = repoAndNumber[0].split("/", 2);
            if (repoAndNumber.length != 2 || parts.length != 2) {
                throw new IllegalArgumentException("Invalid watched PR (expected owner/name#number): " + item);
            }
            try {
                prs.add(new WatchedPr(parts[0].trim(), parts[1].trim(), Integer.parseInt(repoAndNumber[1].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid watched PR number: " + item, e);
            }
        }
        return prs;
    }

    public boolean isTrackedAccount(String login) {
        return login != null && github.username() != null
                && login.toLowerCase(Locale.ROOT).equals(github.username().toLowerCase(Locale.ROOT));
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
