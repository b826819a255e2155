package com.tradecore.event;

public enum SystemEventType {

    /** Startup recovery finished; repositories are loaded and the monitor is running. */
    APPLICATION_READY,

    /** Shutdown sequence finished. */
    SHUTDOWN_COMPLETED,

    /** A repository fell back to its legacy backend or started degraded. */
    STORAGE_DEGRADED
}
