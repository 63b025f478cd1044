package com.ammann.imagebuilder.engine;

/** Termination signals sent while stopping a container. */
public enum SignalKind {
    GRACEFUL("SIGTERM"),
    FORCEFUL("SIGKILL");

    private final String signalName;

    SignalKind(String signalName) {
        this.signalName = signalName;
    }

    public String signalName() {
        return signalName;
    }
}
