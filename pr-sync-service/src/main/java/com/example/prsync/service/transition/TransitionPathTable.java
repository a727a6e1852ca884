package com.example.prsync.service.transition;

import com.example.prsync.dto.TransitionPathStep;
import com.example.prsync.service.board.BoardLane;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Ordered multi-hop steps per status group.
 * Operator entries for the group come first, then the operator "default" entries, then the built-in path.
 */
public class TransitionPathTable {

    public static final String DEFAULT_GROUP = "default";

    private static final List<TransitionPathStep> TOWARDS_REVIEW = List.of(
            TransitionPathStep.byName("Backlog", "Selected for Development"),
            TransitionPathStep.byName("Selected for Development", "In Development"),
            TransitionPathStep.byName("To Do", "In Progress"),
            TransitionPathStep.byName("In Progress", "In Review"),
            TransitionPathStep.byName("In Development", "In Review"));

    private static final List<TransitionPathStep> TOWARDS_DEVELOPMENT = List.of(
            TransitionPathStep.byName("Backlog", "Selected for Development"),
            TransitionPathStep.byName("Selected for Development", "In Development"),
            TransitionPathStep.byName("To Do", "In Progress"));

    private static final List<TransitionPathStep> TOWARDS_QA = List.of(
            TransitionPathStep.byName("In Development", "In Review"),
            TransitionPathStep.byName("In Progress", "In Review"),
            TransitionPathStep.byName("In Review", "Ready for QA"),
            TransitionPathStep.byName("Code Review", "Ready for QA"));

    private static final Map<String, List<TransitionPathStep>> BUILT_IN = Map.of(
            BoardLane.DRAFT_GROUP, TOWARDS_DEVELOPMENT,
            BoardLane.NEEDS_REVIEW_GROUP, TOWARDS_REVIEW,
            BoardLane.REVIEWED_GROUP, TOWARDS_REVIEW,
            BoardLane.MERGED_GROUP, TOWARDS_QA);

    private final Map<String, List<TransitionPathStep>> operatorPaths;

    public TransitionPathTable(Map<String, List<TransitionPathStep>> operatorPaths) {
        this.operatorPaths = operatorPaths != null ? Map.copyOf(operatorPaths) : Map.of();
    }

    public static TransitionPathTable builtInOnly() {
        return new TransitionPathTable(Map.of());
    }

    public List<TransitionPathStep> candidatesFor(String statusGroup) {
        String group = statusGroup == null ? "" : statusGroup.toLowerCase(Locale.ROOT);
        List<TransitionPathStep> candidates = new ArrayList<>(operatorPaths.getOrDefault(group, List.of()));
        candidates.addAll(operatorPaths.getOrDefault(DEFAULT_GROUP, List.of()));
        candidates.addAll(BUILT_IN.getOrDefault(group, List.of()));
        return candidates;
    }

    public int operatorStepCount() {
        return operatorPaths.values().stream().mapToInt(List::size).sum();
    }
}
