package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class AlreadyMemberException extends ClusterOperationException {

    public static final String CODE = "ALREADY_MEMBER";

    public AlreadyMemberException(String address) {
        super("Cannot add DB node " + address + " to cluster, as it is already part of the cluster.",
                CODE, HttpStatus.CONFLICT);
    }
}
