package com.pgcluster.ha.model.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawConsensusStatus {

    private String state;

    public ConsensusRole getRole() {
        return ConsensusRole.fromState(state);
    }
}
