package org.nowstart.tradecore.session;

/**
 * Per-session state keyed by an opaque session key. The store neither validates nor persists keys.
 */
public interface SessionStore {

    /**
     * Returns the state for {@code sessionKey}, creating it on first use.
     */
    SessionState getOrCreate(String sessionKey);

    /**
     * Returns the state for {@code sessionKey} or {@code null} when none exists.
     */
    SessionState find(String sessionKey);

    void clear(String sessionKey);

    void clearAll();
}
