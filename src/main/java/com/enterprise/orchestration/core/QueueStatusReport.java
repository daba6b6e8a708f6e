package com.enterprise.orchestration.core;

/**
 * Snapshot of the task queue and task counts by status
 */
public class QueueStatusReport {

    private final int queued;
    private final int parked;
    private final long pending;
    private final long running;
    private final long completed;
    private final long failed;
    private final long total;

    public QueueStatusReport(int queued, int parked, long pending, long running,
                             long completed, long failed, long total) {
        this.queued = queued;
        this.parked = parked;
        this.pending = pending;
        this.running = running;
        this.completed = completed;
        this.failed = failed;
        this.total = total;
    }

    /** Entries in the ready ordering */
    public int getQueued() { return queued; }

    /** Entries set aside until their dependencies resolve */
    public int getParked() { return parked; }

    public long getPending() { return pending; }
    public long getRunning() { return running; }
    public long getCompleted() { return completed; }
    public long getFailed() { return failed; }
    public long getTotal() { return total; }

    @Override
    public String toString() {
        return String.format("QueueStatusReport{queued=%d, parked=%d, pending=%d, running=%d, completed=%d, failed=%d, total=%d}",
            queued, parked, pending, running, completed, failed, total);
    }
}
