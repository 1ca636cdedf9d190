package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

/**
 * The consensus store or the proxy stats source could not be read. Callers may retry, possibly from another node.
 */
public class TopologyUnavailableException extends ClusterOperationException {

    public static final String CODE = "TOPOLOGY_UNAVAILABLE";

    public TopologyUnavailableException(String message) {
        super(message, CODE, HttpStatus.SERVICE_UNAVAILABLE);
    }
}
