package org.geofacet.junit.extensions.logging;

/**
 * Log levels that {@link LogWatchExtension} can police.
 */
public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
