package com.pgcluster.ha.model.dto;

import com.pgcluster.ha.model.status.ClusterVerdict;
import com.pgcluster.ha.model.status.NodeStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Locale;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterStatusResponse {

    private String status; // healthy, degraded, down
    private int statusCode; // 0, 1, 2; usable directly as a process exit code
    private List<NodeStatus> nodes;
    private List<String> diagnostics;

    public static ClusterStatusResponse from(ClusterVerdict verdict) {
        return ClusterStatusResponse.builder()
                .status(verdict.getStatus().name().toLowerCase(Locale.ROOT))
                .statusCode(verdict.getStatus().getCode())
                .nodes(verdict.getNodes())
                .diagnostics(verdict.getDiagnostics())
                .build();
    }
}
