package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

/**
 * This host runs neither the database nor the client service, so it has no view of the topology.
 */
public class RoleUnsupportedException extends ClusterOperationException {

    public static final String CODE = "ROLE_UNSUPPORTED";

    public RoleUnsupportedException() {
        super("Can only list DB nodes from a client or DB node.", CODE, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
