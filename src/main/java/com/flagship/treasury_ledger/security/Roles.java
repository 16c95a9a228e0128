package com.flagship.treasury_ledger.security;

public final class Roles {

    public static final String GUARDIAN = "guardian";

    private Roles() {
    }
}
