package com.ethnicthv.turn.demo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records who acted, in activation order. Shared by the demo entities.
 */
public final class ActionLog {
    private final List<String> entries = new ArrayList<>();

    public void record(String actor) {
        entries.add(actor);
    }

    public List<String> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** How many times {@code actor} acted. */
    public int count(String actor) {
        int n = 0;
        for (String e : entries) {
            if (e.equals(actor)) n++;
        }
        return n;
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }
}
