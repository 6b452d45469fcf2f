package com.anthem.rxadj.pa;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A request, its determination once made, and every status transition.
 */
@Value
@Builder(toBuilder = true)
public class PriorAuthRecord {

    PriorAuthRequest request;
    PriorAuthResponse response;

    @Singular("statusChange")
    List<StatusChange> statusHistory;

    public PriorAuthStatus getStatus() {
        return response == null ? PriorAuthStatus.PENDING : response.getStatus();
    }
}
