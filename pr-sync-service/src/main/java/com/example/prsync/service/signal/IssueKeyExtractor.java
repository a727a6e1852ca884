package com.example.prsync.service.signal;

import com.example.prsync.config.PrSyncProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts Jira issue keys (e.g. ABC-123, "abc 123", ABC123) from pull request text.
 * Keys are normalised to PREFIX-NUMBER and returned once each, in first-seen order.
 */
@Component
public class IssueKeyExtractor {

    // Jira project keys are at most 10 characters; keys must fit jira_key VARCHAR(50)
    private static final Pattern ISSUE_KEY =
            Pattern.compile("\\b([A-Z]{1,10})[\\s-]?(\\d{1,10})\\b", Pattern.CASE_INSENSITIVE);

    private final Set<String> allowedPrefixes;

    @Autowired
    public IssueKeyExtractor(PrSyncProperties properties) {
        this(properties.jira().allowedKeyPrefixes());
    }

    public IssueKeyExtractor(List<String> allowedPrefixes) {
        Set<String> prefixes = new LinkedHashSet<>();
        for (String prefix : allowedPrefixes) {
            if (prefix != null && !prefix.isBlank()) {
                prefixes.add(prefix.trim().toUpperCase(Locale.ROOT));
            }
        }
        this.allowedPrefixes = prefixes;
    }

    /**
     * Scan the given texts in order (title, branch name, body). Null texts are skipped.
     */
    public List<String> extract(String... texts) {
        Set<String> keys = new LinkedHashSet<>();
        for (String text : texts) {
            if (text == null || text.isEmpty()) {
                continue;
            }
            Matcher matcher = ISSUE_KEY.matcher(text);
            while (matcher.find()) {
                String prefix = matcher.group(1).toUpperCase(Locale.ROOT);
                if (!allowedPrefixes.isEmpty() && !allowedPrefixes.contains(prefix)) {
                    continue;
                }
                keys.add(prefix + "-" + matcher.group(2));
            }
        }
        return new ArrayList<>(keys);
    }
}
