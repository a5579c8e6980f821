// file: sync/src/main/java/io/boardsync/sync/FollowMode.java
package io.boardsync.sync;

import io.boardsync.core.Viewport;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Who this client is following, who is presenting, and the last viewport of every
 * other user.
 * <p>
 * A spotlight started by someone else makes this client follow the presenter unless
 * the user opted out of it. Breaking away from a presenter during a spotlight counts
 * as opting out until the next spotlight starts.
 */
public final class FollowMode {

    /** A user this client follows or is presented to. */
    public record Leader(String userId, String userName) {}

    private final String selfId;
    private final Map<String, Viewport> viewports = new ConcurrentHashMap<>();

    private Leader following;
    private Leader spotlight;
    private boolean optedOut;

    public FollowMode(String selfId) {
        this.selfId = selfId;
    }

    public synchronized void startFollowing(String userId, String userName) {
        if (selfId.equals(userId)) return;
        following = new Leader(userId, userName);
    }

    public synchronized void stopFollowing() {
        following = null;
    }

    /** The user panned or zoomed on their own. */
    public synchronized void breakFollow() {
        if (following == null) return;
        if (spotlight != null && spotlight.userId().equals(following.userId())) optedOut = true;
        following = null;
    }

    public synchronized Optional<Leader> following() {
        return Optional.ofNullable(following);
    }

    public synchronized boolean isFollowing() {
        return following != null;
    }

    /** Viewport of the followed user, once one has arrived. */
    public Optional<Viewport> followedViewport() {
        Leader f = following().orElse(null);
        return f == null ? Optional.empty() : Optional.ofNullable(viewports.get(f.userId()));
    }

    // ---------- spotlight ----------

    public synchronized void spotlightStarted(String userId, String userName) {
        spotlight = new Leader(userId, userName);
        optedOut = false;
        if (!selfId.equals(userId)) following = spotlight;
    }

    public synchronized void spotlightStopped(String userId) {
        if (spotlight == null || !spotlight.userId().equals(userId)) return;
        spotlight = null;
        optedOut = false;
        if (following != null && following.userId().equals(userId)) following = null;
    }

    public synchronized Optional<Leader> spotlight() {
        return Optional.ofNullable(spotlight);
    }

    /** True while this client is the presenter. */
    public synchronized boolean isSpotlighting() {
        return spotlight != null && spotlight.userId().equals(selfId);
    }

    public synchronized boolean spotlightOptedOut() {
        return optedOut;
    }

    public synchronized void optOutOfSpotlight() {
        if (spotlight == null) return;
        optedOut = true;
        if (following != null && following.userId().equals(spotlight.userId())) following = null;
    }

    public synchronized void optInToSpotlight() {
        if (spotlight == null || isSpotlighting()) return;
        optedOut = false;
        following = spotlight;
    }

    // ---------- viewports ----------

    /** Keep the newest viewport per user; our own is never stored. */
    public void updateViewport(Viewport viewport) {
        if (selfId.equals(viewport.userId())) return;
        viewports.merge(viewport.userId(), viewport,
                (held, next) -> next.timestamp() >= held.timestamp() ? next : held);
    }

    public Optional<Viewport> viewport(String userId) {
        return Optional.ofNullable(viewports.get(userId));
    }

    public Map<String, Viewport> viewports() {
        return Map.copyOf(viewports);
    }

    /** Forget users that left; following or a spotlight of theirs ends too. */
    public synchronized void retainOnly(Collection<String> presentUserIds) {
        Set<String> keep = Set.copyOf(presentUserIds);
        viewports.keySet().removeIf(id -> !keep.contains(id));
        if (following != null && !keep.contains(following.userId())) following = null;
        if (spotlight != null && !keep.contains(spotlight.userId())) {
            spotlight = null;
            optedOut = false;
        }
    }
}
