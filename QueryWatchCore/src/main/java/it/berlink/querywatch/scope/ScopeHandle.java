package it.berlink.querywatch.scope;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open monitoring scope. Valid for exactly one {@link ScopeTracker#end(ScopeHandle)} call.
 *
 * {@code startTime} is the wall-clock stamp; elapsed time is measured from {@code startNanos}.
 */
@Getter
@ToString(exclude = "consumed")
public final class ScopeHandle {

    static final int DETACHED = -1;

    private final String label;
    private final int startSequenceIndex;
    private final Instant startTime;
    private final long startNanos;

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean consumed = new AtomicBoolean(false);

    ScopeHandle(String label, int startSequenceIndex, Instant startTime, long startNanos) {
        this.label = label;
        this.startSequenceIndex = startSequenceIndex;
        this.startTime = startTime;
        this.startNanos = startNanos;
    }

    /**
     * A handle that was opened while the log could not be read. Closing it yields no report.
     */
    public static ScopeHandle detached(String label, Instant startTime) {
        return new ScopeHandle(label, DETACHED, startTime, 0L);
    }

    public boolean isDetached() {
        return startSequenceIndex == DETACHED;
    }

    public boolean isConsumed() {
        return consumed.get();
    }

    /**
     * @return true for the first caller only
     */
    boolean consume() {
        return consumed.compareAndSet(false, true);
    }
}
