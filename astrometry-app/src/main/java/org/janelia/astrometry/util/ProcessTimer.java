package org.janelia.astrometry.util;

/**
 * Tracks elapsed time for solves and client runs.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    @Override
    public String toString() {
        final long totalMilliseconds = getElapsedMilliseconds();
        final long totalSeconds = totalMilliseconds / 1000;
        final long minutes = totalSeconds / 60;
        final long seconds = totalSeconds % 60;
        final long milliseconds = totalMilliseconds % 1000;
        return minutes + " minutes, " + seconds + "." + String.format("%03d", milliseconds) + " seconds";
    }
}
