package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

/**
 * The node to be added did not answer the Patroni status probe.
 */
public class NodeNotRespondingException extends ClusterOperationException {

    public static final String CODE = "NODE_NOT_RESPONDING";

    public NodeNotRespondingException(String address) {
        super("DB cluster node " + address + " does not appear to be operational. "
                + "Please ensure DB cluster management software is installed and running before adding the node.",
                CODE, HttpStatus.UNPROCESSABLE_ENTITY);
    }
}
