package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class CannotReinitPrimaryException extends ClusterOperationException {

    public static final String CODE = "CANNOT_REINIT_PRIMARY";

    public CannotReinitPrimaryException(String address) {
        super("The currently active DB master node " + address + " cannot be reinitialised.",
                CODE, HttpStatus.CONFLICT);
    }
}
