package com.company.datasetsplitter.partition;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Canonical instance per distinct category value, scoped to one source file.
 */
public class CategoryInterner {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    public String intern(String value) {
        if (value == null) {
            return null;
        }
        String existing = values.putIfAbsent(value, value);
        return existing != null ? existing : value;
    }

    public int size() {
        return values.size();
    }
}
