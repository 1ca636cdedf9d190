package com.pgcluster.ha.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MembershipResult {

    public static final String OPERATION_ADD = "add";
    public static final String OPERATION_REMOVE = "remove";
    public static final String OPERATION_REINIT = "reinit";
    public static final String OPERATION_PROMOTE = "promote";

    private String operation;
    private String address;
    private boolean confirmed; // false when the outcome could not be observed (e.g. switchover still pending)
    private String message;
}
