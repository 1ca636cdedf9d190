package com.pgcluster.ha.model.status;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the primary's replication list.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReplicationPeer {

    public static final String SYNC_STATE_SYNC = "sync";

    private String peerAddress;
    private String syncState; // sync, async, potential

    public boolean isSync() {
        return SYNC_STATE_SYNC.equals(syncState);
    }
}
