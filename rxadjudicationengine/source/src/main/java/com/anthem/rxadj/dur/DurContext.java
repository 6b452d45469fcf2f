package com.anthem.rxadj.dur;

import com.anthem.rxadj.history.ClaimHistoryEntry;
import com.anthem.rxadj.model.MemberClinicalContext;
import com.anthem.rxadj.model.PharmacyClaim;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Per-claim inputs shared by every DUR check. Owned by the caller and not retained.
 */
@Value
@Builder
public class DurContext {

    PharmacyClaim claim;
    MemberClinicalContext member;
    List<ClaimHistoryEntry> history;
}
