package com.pgcluster.ha.model.status;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalized status of one cluster member for a single status query.
 * Built fresh on every query; errors only accumulate while the query runs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStatus {

    private String address;

    @Builder.Default
    private NodeRole role = NodeRole.UNKNOWN;

    private boolean alive;
    private Long logPosition;
    private Long timeline;

    @Builder.Default
    private ConsensusRole consensusRole = ConsensusRole.DEAD;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @JsonIgnore
    private RawAgentStatus rawStatus;

    public void addError(String error) {
        errors.add(error);
    }

    public boolean hasRawStatus() {
        return rawStatus != null;
    }
}
