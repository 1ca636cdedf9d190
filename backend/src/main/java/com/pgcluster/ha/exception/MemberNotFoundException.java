package com.pgcluster.ha.exception;

import org.springframework.http.HttpStatus;

/**
 * No etcd member is registered for the address.
 */
public class MemberNotFoundException extends ClusterOperationException {

    public static final String CODE = "MEMBER_NOT_FOUND";

    public MemberNotFoundException(String address) {
        super("Cannot find node with address " + address + " for removal.", CODE, HttpStatus.NOT_FOUND);
    }
}
