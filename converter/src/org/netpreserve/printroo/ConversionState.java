package org.netpreserve.printroo;

public enum ConversionState {
    INIT,
    PRE_PROCESS,
    ENSURE_PROCESS_RUNNING,
    NAVIGATE,
    WAIT_WINDOW_STATUS,
    RUN_SCRIPT,
    CAPTURE_SNAPSHOT,
    RENDER,
    CLEANUP,
    DONE,
    FAILED
}
