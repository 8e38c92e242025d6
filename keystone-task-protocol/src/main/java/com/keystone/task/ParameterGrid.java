package com.keystone.task;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named value lists whose Cartesian product defines a parameter sweep. Keys keep insertion order;
 * combinations are generated with the last key varying fastest.
 */
public final class ParameterGrid {

    private final Map<String, List<Object>> values;

    private ParameterGrid(Map<String, List<Object>> values) {
        this.values = values;
    }

    /**
     * @throws SubmissionException when a key has no values
     */
    public static ParameterGrid of(Map<String, ? extends List<?>> grid) {
        Objects.requireNonNull(grid, "grid");
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        grid.forEach((key, list) -> {
            if (list == null || list.isEmpty()) {
                throw new SubmissionException("Parameter '" + key + "' has no values");
            }
            copy.put(key, Collections.unmodifiableList(new ArrayList<>(list)));
        });
        return new ParameterGrid(Collections.unmodifiableMap(copy));
    }

    public Map<String, List<Object>> getValues() {
        return values;
    }

    /** Product of the value list sizes; 1 for an empty grid. */
    public int size() {
        int n = 1;
        for (List<Object> list : values.values()) {
            n = Math.multiplyExact(n, list.size());
        }
        return n;
    }

    /** All combinations; an empty grid yields one empty combination. */
    public List<Map<String, Object>> combinations() {
        List<String> keys = new ArrayList<>(values.keySet());
        List<Map<String, Object>> out = new ArrayList<>(size());
        int[] index = new int[keys.size()];
        int total = size();
        for (int n = 0; n < total; n++) {
            Map<String, Object> combo = new LinkedHashMap<>();
            for (int k = 0; k < keys.size(); k++) {
                combo.put(keys.get(k), values.get(keys.get(k)).get(index[k]));
            }
            out.add(Collections.unmodifiableMap(combo));
            for (int k = keys.size() - 1; k >= 0; k--) {
                if (++index[k] < values.get(keys.get(k)).size()) break;
                index[k] = 0;
            }
        }
        return out;
    }
}
