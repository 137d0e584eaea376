package me.go_gradually.ivrphone.domain.dtmf;

import java.util.ArrayList;
import java.util.List;

/**
 * Digits typed by the caller during one collection round, in arrival order.
 * Every mutation goes through the same monitor, so a drain never loses or repeats
 * a digit appended concurrently with it.
 */
public class KeyCollector {
    private final Object lock = new Object();
    private final List<Character> keys = new ArrayList<>();

    public void append(char key) {
        synchronized (lock) {
            keys.add(key);
        }
    }

    public List<Character> drainAndClear() {
        synchronized (lock) {
            if (keys.isEmpty()) {
                return List.of();
            }
            List<Character> drained = List.copyOf(keys);
            keys.clear();
            return drained;
        }
    }

    public int size() {
        synchronized (lock) {
            return keys.size();
        }
    }
}
