package com.questrail.crossval.config;

import java.util.Locale;

/**
 * Which transport a session validates through.
 */
public enum TransportKind
{
    /** TCP connections to a coordinator hosted by instance 0. */
    SOCKET,
    /** A memory-mapped segment shared by all instances on one host. */
    SHM;

    /**
     * Parses {@code socket} or {@code shm}, ignoring case.
     *
     * @throws IllegalArgumentException for any other value
     */
    public static TransportKind fromName(String name) {
        String n = name.trim().toLowerCase(Locale.ROOT);
        switch (n) {
            case "socket":
                return SOCKET;
            case "shm":
                return SHM;
            default:
                throw new IllegalArgumentException("Unknown transport '" + name + "' (expected socket or shm)");
        }
    }
}
