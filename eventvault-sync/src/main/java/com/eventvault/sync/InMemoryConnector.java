package com.eventvault.sync;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mirror kept in process memory. Used when no remote endpoint is configured,
 * and by tests, which can take it offline or make it throttle.
 */
@Slf4j
public class InMemoryConnector implements RemoteConnector {

    public static final int MAX_RECORDED_CALLS = 1_000;

    private final Map<String, JsonNode> tables = new ConcurrentHashMap<>();
    private final Map<String, List<JsonNode>> partial = new ConcurrentHashMap<>();
    /** Most recent calls, oldest first; bounded by {@link #MAX_RECORDED_CALLS}. */
    private final Deque<String> calls = new ArrayDeque<>();
    private final AtomicInteger throttleRemaining = new AtomicInteger();
    private volatile long throttleRetryAfterMs;
    private volatile boolean connected = true;

    @Override
    public boolean isConnected() {
        return connected;
    }

    public void setConnected(boolean connected) {
        this.connected = connected;
    }

    /**
     * Make the next {@code count} calls fail with a throttling signal.
     */
    public void throttleNext(int count, long retryAfterMs) {
        this.throttleRetryAfterMs = retryAfterMs;
        throttleRemaining.set(count);
    }

    @Override
    public void push(String key, JsonNode document) throws RemoteException {
        checkCall("push " + key);
        tables.put(key, document.deepCopy());
    }

    @Override
    public void pushBatch(String key, RecordBatch batch) throws RemoteException {
        checkCall("batch " + key + " " + batch.index() + "/" + batch.total());
        List<JsonNode> rows = batch.isFirst()
                ? new ArrayList<>()
                : partial.computeIfAbsent(key, k -> new ArrayList<>());
        rows.addAll(batch.records());
        if (batch.isLast()) {
            partial.remove(key);
            tables.put(key, RecordBatch.assemble(batch.shape(), rows));
        } else {
            partial.put(key, rows);
        }
    }

    @Override
    public Optional<JsonNode> pull(String key) throws RemoteException {
        checkCall("pull " + key);
        JsonNode table = tables.get(key);
        return table == null ? Optional.empty() : Optional.of(table.deepCopy());
    }

    /** Seed the mirror directly, bypassing call accounting. */
    public void put(String key, JsonNode document) {
        tables.put(key, document.deepCopy());
    }

    public Optional<JsonNode> get(String key) {
        return Optional.ofNullable(tables.get(key));
    }

    /**
     * The last {@value #MAX_RECORDED_CALLS} calls attempted, in order, e.g.
     * {@code "push events"}.
     */
    public List<String> getCalls() {
        synchronized (calls) {
            return List.copyOf(calls);
        }
    }

    @Override
    public String describe() {
        return "in-memory mirror";
    }

    private void checkCall(String call) throws RemoteException {
        synchronized (calls) {
            if (calls.size() == MAX_RECORDED_CALLS) {
                calls.removeFirst();
            }
            calls.addLast(call);
        }
        if (!connected) {
            throw new RemoteUnavailableException("in-memory mirror is offline");
        }
        if (throttleRemaining.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            log.debug("Throttling {}", call);
            throw new RemoteThrottledException("throttled", throttleRetryAfterMs);
        }
    }
}
