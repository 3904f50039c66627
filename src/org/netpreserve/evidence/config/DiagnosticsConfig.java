package org.netpreserve.evidence.config;

/**
 * @param signal name of the OS signal that prints the pacing scoreboard (without the SIG prefix)
 */
public record DiagnosticsConfig(String signal) {
}
