package org.netpreserve.evidence.pacing;

public enum Outcome {
    SUCCESS, THROTTLED, ERROR
}
