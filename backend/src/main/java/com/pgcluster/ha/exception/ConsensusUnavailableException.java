package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

/**
 * etcd did not answer within the auth detection window.
 * Usually a majority of members is not installed yet.
 */
public class ConsensusUnavailableException extends ClusterOperationException {

    public static final String CODE = "CONSENSUS_UNAVAILABLE";

    public ConsensusUnavailableException(String message) {
        super(message, CODE, HttpStatus.SERVICE_UNAVAILABLE);
    }
}
