package com.panelgate.gateway.proxy;

import lombok.Getter;

import javax.net.ssl.SSLException;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.security.cert.CertificateException;

/**
 * The device WebSocket could not be opened.
 */
@Getter
public class BackendConnectException extends Exception {

    private static final int MAX_DETAIL = 80;

    /**
     * Coarse failure category; the short reason is what the browser sees in the close frame.
     */
    public enum FailureKind {
        SSL("ssl"),
        REFUSED("refused"),
        PORT("port"),
        OTHER(null);

        private final String reason;

        FailureKind(String reason) {
            this.reason = reason;
        }
    }

    private final FailureKind kind;

    public BackendConnectException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Short close reason: the category name, or a truncated message for {@link FailureKind#OTHER}.
     */
    public String closeReason() {
        if (kind.reason != null) {
            return kind.reason;
        }
        String msg = getMessage() == null || getMessage().isBlank() ? "device connection failed" : getMessage();
        return msg.length() > MAX_DETAIL ? msg.substring(0, MAX_DETAIL) : msg;
    }

    /**
     * Categorize a dial failure by walking its cause chain.
     */
    public static BackendConnectException classify(Throwable failure) {
        if (failure instanceof BackendConnectException bce) {
            return bce;
        }
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SSLException || t instanceof CertificateException) {
                return new BackendConnectException(FailureKind.SSL, t.getMessage(), failure);
            }
            if (t instanceof ConnectException) {
                return new BackendConnectException(FailureKind.REFUSED, t.getMessage(), failure);
            }
            if (t instanceof UnknownHostException || t instanceof SocketTimeoutException
                    || t instanceof NoRouteToHostException) {
                return new BackendConnectException(FailureKind.PORT, t.getMessage(), failure);
            }
            if (t.getCause() == t) {
                break;
            }
        }
        String message = failure == null ? null : failure.getMessage();
        if (message == null && failure != null) {
            message = failure.getClass().getSimpleName();
        }
        return new BackendConnectException(FailureKind.OTHER, message, failure);
    }
}
