package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class CannotRemovePrimaryException extends ClusterOperationException {

    public static final String CODE = "CANNOT_REMOVE_PRIMARY";

    public CannotRemovePrimaryException(String address) {
        super("The currently active DB master node " + address + " cannot be removed. "
                + "Please set the master to a different node before retrying.",
                CODE, HttpStatus.CONFLICT);
    }
}
