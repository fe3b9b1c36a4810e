package com.questrail.adbemu.protocol.adb.config;

import java.net.InetAddress;
import java.net.UnknownHostException;

/**
 * Address family of the emulator's listening socket. The emulator always binds
 * the loopback address of the chosen family.
 */
public enum AddressFamily {
    IPV4(new byte[] { 127, 0, 0, 1 }),
    IPV6(new byte[] { 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 1 });

    private final byte[] loopback;

    AddressFamily(byte[] loopback) {
        this.loopback = loopback;
    }

    /**
     * Returns {@code 127.0.0.1} or {@code ::1}.
     */
    public InetAddress loopbackAddress() {
        try {
            return InetAddress.getByAddress(loopback.clone());
        } catch (UnknownHostException e) {
            // Only thrown for an illegal address length.
            throw new IllegalStateException("Invalid loopback address for " + this, e);
        }
    }
}
