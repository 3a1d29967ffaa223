package com.iimsoft.timeline.domain;

import java.time.LocalDateTime;
import java.util.Objects;

/** Start and exclusive end. */
public final class DateSpan {
    private final LocalDateTime start;
    private final LocalDateTime end;

    public DateSpan(LocalDateTime start, LocalDateTime end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public LocalDateTime getStart() { return start; }
    public LocalDateTime getEnd() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateSpan)) return false;
        DateSpan that = (DateSpan) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + " -> " + end;
    }
}
