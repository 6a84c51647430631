package com.scout.run;

public class DuplicateRunException extends RuntimeException {

    public DuplicateRunException(String runId) {
        super("Run " + runId + " is already in progress");
    }
}
