package org.nowstart.tradecore.session;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.nowstart.tradecore.data.property.TradingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class InMemorySessionStore implements SessionStore {

    private final Map<String, SessionState> sessions = new ConcurrentHashMap<>();
    private final int regimeCapacity;
    private final int outcomeCapacity;

    @Autowired
    public InMemorySessionStore(TradingProperties tradingProperties) {
        this(tradingProperties.regimeHistorySize(), tradingProperties.tradeOutcomeHistorySize());
    }

    public InMemorySessionStore(int regimeCapacity, int outcomeCapacity) {
        this.regimeCapacity = regimeCapacity;
        this.outcomeCapacity = outcomeCapacity;
    }

    @Override
    public SessionState getOrCreate(String sessionKey) {
        return sessions.computeIfAbsent(requireKey(sessionKey), ignored -> new SessionState(regimeCapacity, outcomeCapacity));
    }

    @Override
    public SessionState find(String sessionKey) {
        return sessionKey == null ? null : sessions.get(sessionKey);
    }

    @Override
    public void clear(String sessionKey) {
        if (sessionKey != null) {
            sessions.remove(sessionKey);
        }
    }

    @Override
    public void clearAll() {
        sessions.clear();
    }

    public int size() {
        return sessions.size();
    }

    private String requireKey(String sessionKey) {
        if (sessionKey == null || sessionKey.isBlank()) {
            throw new IllegalArgumentException("sessionKey is required");
        }
        return sessionKey;
    }
}
