package com.example.prsync.service.board;

import com.example.prsync.dto.response.BoardResponse;
import com.example.prsync.dto.response.PullRequestResponse;
import com.example.prsync.entity.PullRequestRecord;
import com.example.prsync.entity.PullRequestState;
import com.example.prsync.repository.PullRequestRecordRepository;
import com.example.prsync.service.signal.ReviewStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Groups stored pull requests into board lanes.
 * Open records are split by ownership and review status; merged ones count only if merged today (UTC).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BoardService {

    private final PullRequestRecordRepository pullRequestRecordRepository;
    private final Clock clock;

    @Transactional(readOnly = true)
    public BoardResponse board() {
        LocalDateTime startOfToday = LocalDate.now(clock).atStartOfDay();

        Map<BoardLane, List<PullRequestResponse>> lanes = new EnumMap<>(BoardLane.class);
        for (BoardLane lane : BoardLane.values()) {
            lanes.put(lane, new ArrayList<>());
        }

        for (PullRequestRecord record : pullRequestRecordRepository.findByStateOrderByMineDescUpdatedAtDesc(PullRequestState.OPEN)) {
            lanes.get(laneFor(record)).add(PullRequestResponse.from(record));
        }
        for (PullRequestRecord record : pullRequestRecordRepository
                .findByStateAndMergedAtGreaterThanEqualOrderByMineDescUpdatedAtDesc(PullRequestState.MERGED, startOfToday)) {
            lanes.get(BoardLane.MERGED).add(PullRequestResponse.from(record));
        }

        List<BoardResponse.Lane> result = new ArrayList<>();
        lanes.forEach((lane, pullRequests) ->
                result.add(new BoardResponse.Lane(lane.name(), lane.title(), pullRequests)));
        log.debug("Board built: {}", result.stream().map(l -> l.getCode() + "=" + l.getPullRequests().size()).toList());
        return BoardResponse.builder().lanes(result).build();
    }

    public static BoardLane laneFor(PullRequestRecord record) {
        if (record.getState() == PullRequestState.MERGED) {
            return BoardLane.MERGED;
        }
        if (!record.isMine()) {
            return BoardLane.TO_REVIEW;
        }
        return ReviewStatus.isReviewedLabel(record.getReviewStatus()) ? BoardLane.REVIEWED : BoardLane.NEEDS_REVIEW;
    }
}
