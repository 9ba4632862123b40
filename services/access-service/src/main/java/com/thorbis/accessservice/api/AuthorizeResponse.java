package com.thorbis.accessservice.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Decision returned to the caller. A denial carries only {@code decision} and the public reason.
 *
 * @param decision      {@code allow} or {@code deny}
 * @param reason        public reason
 * @param ruleId        matched rule, allows only
 * @param policyVersion policy snapshot used, allows only
 * @param auditSequence sequence number of the decision's audit entry, allows only
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthorizeResponse(
        String decision, String reason, String ruleId, String policyVersion, Long auditSequence) {

    static AuthorizeResponse allow(String ruleId, String policyVersion, long auditSequence) {
        return new AuthorizeResponse("allow", "granted", ruleId, policyVersion, auditSequence);
    }

    static AuthorizeResponse deny(String reason) {
        return new AuthorizeResponse("deny", reason, null, null, null);
    }
}
