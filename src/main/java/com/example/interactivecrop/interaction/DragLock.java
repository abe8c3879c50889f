package com.example.interactivecrop.interaction;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide claim on the single pointer device. At most one owner holds the lock at a time;
 * acquiring it while someone else holds it force-releases the previous owner first.
 *
 * <p>One instance is shared by all sessions of the application. Tests create their own.</p>
 */
public class DragLock {

    private static final Logger log = LoggerFactory.getLogger(DragLock.class);

    private String ownerId;
    private Runnable release;

    public synchronized void acquire(String newOwnerId, Runnable onForcedRelease) {
        if (ownerId != null) {
            log.debug("Drag lock moving from {} to {}", ownerId, newOwnerId);
            forceRelease();
        }
        ownerId = newOwnerId;
        release = onForcedRelease;
    }

    public synchronized boolean release(String candidateOwnerId) {
        if (ownerId == null || !ownerId.equals(candidateOwnerId)) {
            return false;
        }
        clear();
        return true;
    }

    /**
     * Ends whichever drag is live by running its owner's release callback. Calling this with no
     * live drag does nothing.
     *
     * @return whether a drag was released
     */
    public synchronized boolean forceRelease() {
        if (ownerId == null) {
            return false;
        }
        Runnable callback = release;
        clear();
        if (callback != null) {
            callback.run();
        }
        return true;
    }

    public synchronized Optional<String> owner() {
        return Optional.ofNullable(ownerId);
    }

    public synchronized boolean isHeldBy(String candidateOwnerId) {
        return ownerId != null && ownerId.equals(candidateOwnerId);
    }

    private void clear() {
        ownerId = null;
        release = null;
    }
}
