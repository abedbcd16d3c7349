package com.flagship.hospital_cash.auth;

/**
 * Names of the HTTP session attributes set at login.
 */
public final class SessionAttributes {

    public static final String USER = "user";
    public static final String PROJECT = "project";

    private SessionAttributes() {
        // Constants only
    }
}
