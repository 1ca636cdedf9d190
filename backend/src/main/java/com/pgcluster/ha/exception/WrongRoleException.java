package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

public class WrongRoleException extends ClusterOperationException {

    public static final String CODE = "WRONG_ROLE";

    public WrongRoleException(String message) {
        super(message, CODE, HttpStatus.BAD_REQUEST);
    }
}
