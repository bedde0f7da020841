package com.eventvault.store.integrity;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Every fix applied during one validator run, in the order applied.
 */
@Slf4j
public class FixReport {

    private static final int LOGGED_FIXES = 10;

    private final List<Fix> fixes = new ArrayList<>();

    void add(Fix fix) {
        fixes.add(fix);
    }

    void addAll(List<Fix> more) {
        fixes.addAll(more);
    }

    public List<Fix> getFixes() {
        return Collections.unmodifiableList(fixes);
    }

    public boolean isEmpty() {
        return fixes.isEmpty();
    }

    public int size() {
        return fixes.size();
    }

    public List<Fix> forResource(String key) {
        return fixes.stream().filter(f -> f.resourceKey().equals(key)).toList();
    }

    public long count(FixKind kind) {
        return fixes.stream().filter(f -> f.kind() == kind).count();
    }

    void log() {
        if (fixes.isEmpty()) {
            log.info("All resources are healthy, no fixes needed");
            return;
        }
        log.info("Integrity check applied {} fix(es)", fixes.size());
        fixes.stream().limit(LOGGED_FIXES).forEach(fix -> log.info("  {}", fix));
        if (fixes.size() > LOGGED_FIXES) {
            log.info("  ... and {} more fixes", fixes.size() - LOGGED_FIXES);
        }
    }
}
