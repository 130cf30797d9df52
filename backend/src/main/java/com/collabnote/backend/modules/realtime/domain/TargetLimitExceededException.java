package com.collabnote.backend.modules.realtime.domain;

public class TargetLimitExceededException extends RuntimeException {

    private final int limit;

    public TargetLimitExceededException(String connectionId, int limit) {
        super("Connection " + connectionId + " already follows " + limit + " targets");
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
