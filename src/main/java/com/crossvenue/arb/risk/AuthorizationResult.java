package com.crossvenue.arb.risk;

import com.crossvenue.arb.domain.CapitalAllocation;
import com.crossvenue.arb.domain.RejectionReason;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Either an allocation or the first check that failed. Never both, never a partial allocation.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AuthorizationResult {
    CapitalAllocation allocation;
    RejectionReason rejectionReason;
    String message;

    public static AuthorizationResult approved(CapitalAllocation allocation) {
        return new AuthorizationResult(allocation, null, null);
    }

    public static AuthorizationResult rejected(RejectionReason reason, String message) {
        return new AuthorizationResult(null, reason, message);
    }

    public boolean isApproved() {
        return allocation != null;
    }
}
