package io.mvccstore.segment.snapshot;

import com.google.common.collect.ImmutableList;

import java.util.List;

import io.mvccstore.segment.SegmentEntry;

/**
 * The outcome of resolving a snapshot mode, before any ordering is applied.
 */
public final class Resolution {
    public final List<SegmentEntry> eligible;
    public final VisibilityRule rule;

    public Resolution(List<SegmentEntry> eligible, VisibilityRule rule) {
        this.eligible = ImmutableList.copyOf(eligible);
        this.rule = rule;
    }
}
