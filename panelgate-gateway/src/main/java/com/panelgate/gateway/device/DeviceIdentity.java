package com.panelgate.gateway.device;

/**
 * Normalized names of one kiosk.
 *
 * @param shortName          lower-case host label before the first dot, e.g. {@code ns1234}
 * @param fullyQualifiedName lower-case host name the gateway dials
 * @param upperCaseName      upper-cased short name, used in certificate storage keys
 */
public record DeviceIdentity(String shortName, String fullyQualifiedName, String upperCaseName) {

    @Override
    public String toString() {
        return fullyQualifiedName;
    }
}
