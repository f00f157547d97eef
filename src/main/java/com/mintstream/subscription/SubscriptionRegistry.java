package com.mintstream.subscription;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Set of tokens with an outstanding trade subscription on the live feed.
 *
 * <p>Written by the message dispatcher (onboarding) and by the unsubscribe sweeper, which run
 * on different threads. Every read and write takes the same lock, and the subscribe or
 * unsubscribe command for a token is sent while that lock is held, so membership and the
 * feed-side subscription always change together:
 * <ul>
 *   <li>{@link #markSubscribed} adds the token first and then sends, so a second sighting of
 *       the same token can never send a duplicate subscribe.</li>
 *   <li>{@link #markUnsubscribed} removes a token only after its unsubscribe was accepted for
 *       sending. If the session is down the token stays and is retried on the next sweep.</li>
 * </ul>
 *
 * <p>The sender callbacks only touch the session's own send lock, never this one. The set
 * lives for the process lifetime and is not persisted.
 */
@Component
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<String> subscribed = new LinkedHashSet<>();

    /**
     * Sends a subscribe or unsubscribe command for the given tokens.
     * Returns true if the command was accepted by the live session.
     */
    @FunctionalInterface
    public interface SubscriptionSender {
        boolean send(List<String> mints);
    }

    /**
     * Adds the token and, still under the lock, invokes the sender.
     *
     * <p>A token that is already present is a no-op and the sender is not called. A sender
     * that returns false (no live session) leaves the token in the set; it is subscribed
     * again when the next session becomes active.
     *
     * @return true if the token was newly added
     */
    public boolean markSubscribed(String mint, SubscriptionSender subscribeSender) {
        lock.lock();
        try {
            if (!subscribed.add(mint)) {
                return false;
            }
            if (!subscribeSender.send(List.of(mint))) {
                log.debug("Subscribe for {} not sent, will be sent when the feed session is active", mint);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Sends an unsubscribe for each candidate currently in the set and removes the ones whose
     * command was accepted. Candidates not in the set are ignored. Stops at the first rejected
     * send since the session is gone at that point.
     *
     * @return tokens actually removed, in send order
     */
    public Set<String> markUnsubscribed(Collection<String> candidates, SubscriptionSender unsubscribeSender) {
        Set<String> removed = new LinkedHashSet<>();
        lock.lock();
        try {
            for (String mint : candidates) {
                if (!subscribed.contains(mint)) {
                    continue;
                }
                if (!unsubscribeSender.send(List.of(mint))) {
                    log.debug("Unsubscribe for {} not sent, keeping it for the next sweep", mint);
                    break;
                }
                subscribed.remove(mint);
                removed.add(mint);
            }
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /**
     * Sends one subscribe covering every token in the set. Used when a fresh session becomes
     * active, since the feed forgets per-token subscriptions on disconnect.
     *
     * @return number of tokens re-subscribed, 0 if the set is empty or the send was rejected
     */
    public int resubscribeAll(SubscriptionSender subscribeSender) {
        lock.lock();
        try {
            if (subscribed.isEmpty()) {
                return 0;
            }
            return subscribeSender.send(List.copyOf(subscribed)) ? subscribed.size() : 0;
        } finally {
            lock.unlock();
        }
    }

    public boolean isSubscribed(String mint) {
        lock.lock();
        try {
            return subscribed.contains(mint);
        } finally {
            lock.unlock();
        }
    }

    /** Returns a copy of the current set. */
    public Set<String> snapshot() {
        lock.lock();
        try {
            return Set.copyOf(subscribed);
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return subscribed.size();
        } finally {
            lock.unlock();
        }
    }
}
