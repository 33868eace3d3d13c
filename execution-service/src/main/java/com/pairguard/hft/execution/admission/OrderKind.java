package com.pairguard.hft.execution.admission;

public enum OrderKind {
    ORDER,
    CANCEL,
    REPLACE;

    public boolean isCancelOrReplace() {
        return this != ORDER;
    }
}
