package com.agriguard.api;

final class Headers {

    /** Address of the account submitting the operation. */
    static final String CALLER = "X-Caller";

    private Headers() {
    }
}
