package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class AlreadyPrimaryException extends ClusterOperationException {

    public static final String CODE = "ALREADY_PRIMARY";

    public AlreadyPrimaryException(String address) {
        super("The selected node " + address + " is the current master.", CODE, HttpStatus.CONFLICT);
    }
}
