package org.introspect.capture;

/**
 * Transform-time identity of one memoization cell. Indices are unique within one assertion occurrence.
 */
public record CaptureSlot(int index) {

    public CaptureSlot {
        if (index < 0) {
            throw new IllegalArgumentException("Negative slot index: " + index);
        }
    }
}
