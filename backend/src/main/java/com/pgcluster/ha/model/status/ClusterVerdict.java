package com.pgcluster.ha.model.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClusterVerdict {

    private ClusterHealth status;
    private List<NodeStatus> nodes;

    /** Cluster-wide findings that belong to no single node, e.g. lost consensus. */
    @Builder.Default
    private List<String> diagnostics = new ArrayList<>();
}
