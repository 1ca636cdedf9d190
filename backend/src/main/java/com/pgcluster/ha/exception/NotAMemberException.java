package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class NotAMemberException extends ClusterOperationException {

    public static final String CODE = "NOT_A_MEMBER";

    public NotAMemberException(String address, String action) {
        super("Cannot " + action + " DB node " + address + ", as it is not part of the cluster.",
                CODE, HttpStatus.NOT_FOUND);
    }
}
