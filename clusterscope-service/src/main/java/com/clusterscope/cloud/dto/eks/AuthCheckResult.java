package com.clusterscope.cloud.dto.eks;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AuthCheckResult {
    private boolean authenticated;
    private String identity;
    private String account;
    private String reason;

    public static AuthCheckResult authenticated(String identity, String account) {
        return new AuthCheckResult(true, identity, account, null);
    }

    public static AuthCheckResult unauthenticated(String reason) {
        return new AuthCheckResult(false, null, null, reason);
    }
}
