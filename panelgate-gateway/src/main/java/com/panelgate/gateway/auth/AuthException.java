package com.panelgate.gateway.auth;

import lombok.Getter;

/**
 * Connect-time credential validation failure. Fatal to the session.
 */
@Getter
public class AuthException extends RuntimeException {

    /**
     * Why the credential was rejected.
     */
    public enum Reason {
        MISSING_CREDENTIAL("Missing KEYME-TOKEN"),
        VALIDATION_UNREACHABLE("Token validation failed"),
        INVALID_OR_EXPIRED("Invalid or expired token"),
        INSUFFICIENT_CAPABILITY("Access denied: insufficient permissions");

        private final String detail;

        Reason(String detail) {
            this.detail = detail;
        }

        public String detail() {
            return detail;
        }
    }

    private final Reason reason;

    public AuthException(Reason reason) {
        super(reason.detail());
        this.reason = reason;
    }

    public AuthException(Reason reason, Throwable cause) {
        super(reason.detail(), cause);
        this.reason = reason;
    }
}
