package com.demo.multisig.controller;

public final class RequestHeaders {

    /** Authenticated user id, set by the upstream identity gateway. */
    public static final String USER_ID = "X-User-Id";

    private RequestHeaders() {}
}
