package com.p14n.shadowsync.shadow;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps shadows in memory along with the most recent saved versions of each,
 * up to a fixed number per device.
 */
public class InMemoryShadowRepository implements ShadowRepository {

    public static final int DEFAULT_HISTORY_SIZE = 100;

    private final Map<String, ShadowDocument> documents = new ConcurrentHashMap<>();
    private final Map<String, Deque<ShadowDocument>> histories = new ConcurrentHashMap<>();
    private final int historySize;

    public InMemoryShadowRepository() {
        this(DEFAULT_HISTORY_SIZE);
    }

    public InMemoryShadowRepository(int historySize) {
        if (historySize < 0) {
            throw new IllegalArgumentException("History size cannot be negative");
        }
        this.historySize = historySize;
    }

    @Override
    public Optional<ShadowDocument> loadShadow(String deviceId) {
        return Optional.ofNullable(documents.get(deviceId));
    }

    @Override
    public boolean saveShadow(ShadowDocument document) {
        ShadowDocument stored = documents.compute(document.deviceId(),
                (id, current) -> current != null && current.version() > document.version() ? current : document);
        if (stored != document) {
            return false;
        }
        if (historySize > 0) {
            Deque<ShadowDocument> history = histories.computeIfAbsent(document.deviceId(), id -> new ArrayDeque<>());
            synchronized (history) {
                ShadowDocument newest = history.peekFirst();
                if (newest != null && newest.version() == document.version()) {
                    history.removeFirst();
                }
                history.addFirst(document);
                while (history.size() > historySize) {
                    history.removeLast();
                }
            }
        }
        return true;
    }

    @Override
    public List<ShadowDocument> history(String deviceId, int limit) {
        Deque<ShadowDocument> history = histories.get(deviceId);
        List<ShadowDocument> result = new ArrayList<>();
        if (history == null) {
            return result;
        }
        synchronized (history) {
            for (Iterator<ShadowDocument> it = history.iterator(); it.hasNext() && result.size() < limit;) {
                result.add(it.next());
            }
        }
        return result;
    }

    public int size() {
        return documents.size();
    }
}
