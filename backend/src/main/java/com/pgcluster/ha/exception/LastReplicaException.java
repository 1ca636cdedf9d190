package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class LastReplicaException extends ClusterOperationException {

    public static final String CODE = "LAST_REPLICA";

    public LastReplicaException() {
        super("The last replica cannot be removed. A new replica must be added before removing the target node.",
                CODE, HttpStatus.CONFLICT);
    }
}
