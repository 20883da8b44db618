package io.mvccstore.segment.pin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.mvccstore.host.BufferPin;
import io.mvccstore.host.PageStorage;
import io.mvccstore.util.Try;

/**
 * The pins a store holds on the pin-test blocks of the segments it loaded, so reclamation leaves their pages alone
 * while the store is alive.
 *
 * A block is pinned at most once per set, pinning it again is a no-op. Pins are only given back by
 * {@link #unpin(long)} or {@link #unpinAll()}, never implicitly.
 */
public class PinSet {
    private static final Logger log = LoggerFactory.getLogger(PinSet.class);

    private final PageStorage pages;
    private final Map<Long, BufferPin> pins = new LinkedHashMap<>();

    public PinSet(PageStorage pages) {
        this.pages = pages;
    }

    /**
     * @return true if the block was not pinned by this set before.
     */
    public synchronized boolean pin(long block) {
        if (pins.containsKey(block)) {
            return false;
        }
        pins.put(block, pages.pin(block));
        return true;
    }

    /**
     * @return true if the block was pinned by this set.
     */
    public synchronized boolean unpin(long block) {
        BufferPin pin = pins.remove(block);
        if (pin == null) {
            return false;
        }
        pin.close();
        return true;
    }

    public synchronized boolean isPinned(long block) {
        return pins.containsKey(block);
    }

    public synchronized int size() {
        return pins.size();
    }

    public synchronized Set<Long> blocks() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(pins.keySet()));
    }

    /**
     * Release every pin. Keeps going if one release fails.
     */
    public synchronized void unpinAll() {
        List<BufferPin> held = new ArrayList<>(pins.values());
        pins.clear();
        for (BufferPin pin : held) {
            Try.on(pin::close, log, "Failed to release pin on block " + pin.block());
        }
        if (!held.isEmpty()) {
            log.debug("released {} pins", held.size());
        }
    }
}
