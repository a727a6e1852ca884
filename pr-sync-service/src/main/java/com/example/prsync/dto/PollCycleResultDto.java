package com.example.prsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregate of one poll pass.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PollCycleResultDto {

    private String correlationId;

    @Builder.Default
    private List<SyncResultDto> results = new ArrayList<>();

    private int rejected;

    public long failedCount() {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }

    public long degradedCount() {
        return results.stream().filter(SyncResultDto::isDegraded).count();
    }
}
