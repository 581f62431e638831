package me.golemcore.newsroom.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Current status of a run, derived from its latest checkpoint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunSummaryDto {
    private String runId;
    private String status;
    private long step;
    private String node;
    private String hint;
    private String failureKind;
    private String failureMessage;
    private String draft;
    private String qualityVerdict;
    private Double qualityScore;
    private boolean published;
    private Instant updatedAt;
}
