package com.example.prsync.dto.request;

import com.example.prsync.service.board.BoardLane;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to move the linked Jira issue so it matches a board lane.
 * issueKey defaults to the record's primary key; draft defaults to the record's draft flag.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TransitionRequest {

    @NotNull(message = "Lane is required")
    private BoardLane lane;

    private Boolean draft;

    private String issueKey;
}
