package com.lendingledger.api;

public final class ApiHeaders {

    /** Identity of the calling account. Administrator and borrower checks compare against it. */
    public static final String CALLER_ID = "X-Caller-Id";

    private ApiHeaders() {}
}
