package io.beaconmesh.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Set;

import static io.beaconmesh.constant.MeshConstant.DEDUP_CAPACITY;
import static io.beaconmesh.utils.HashUtils.truncatedHashHex;

/**
 * Remembers hashes of the most recently received frames. Once full, the oldest recorded hash is forgotten.
 * Only touched from the event loop.
 */
@Slf4j
public class DedupFilter {
    private final int capacity;
    private final Set<String> frameHashes = new LinkedHashSet<>();

    public DedupFilter() {
        this(DEDUP_CAPACITY);
    }

    public DedupFilter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive");
        }
        this.capacity = capacity;
    }

    public static String hashOf(byte[] raw) {
        return truncatedHashHex(raw);
    }

    public boolean isDuplicate(String frameHash) {
        return frameHashes.contains(frameHash);
    }

    /**
     * @return false when the hash was already known
     */
    public boolean record(String frameHash) {
        if (!frameHashes.add(frameHash)) {
            return false;
        }
        if (frameHashes.size() > capacity) {
            Iterator<String> oldest = frameHashes.iterator();
            log.trace("Dedup filter full, forgetting {}", oldest.next());
            oldest.remove();
        }

        return true;
    }

    public int size() {
        return frameHashes.size();
    }

    public void clear() {
        frameHashes.clear();
    }
}
