package com.panelgate.gateway.proxy;

/**
 * Close codes sent to the browser.
 */
public final class CloseCodes {

    private CloseCodes() {
    }

    public static final int NORMAL = 1000;
    public static final int BACKEND_ERROR = 1011;
    public static final int INVALID_DEVICE = 4400;
    public static final int UNAUTHORIZED = 4401;
    public static final int FORBIDDEN_ENVIRONMENT = 4403;
    public static final int SERVER_CONFIG = 4500;
}
