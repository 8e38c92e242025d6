package com.keystone.task;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ParameterGridTest {

    @Test
    void combinationsVaryLastKeyFastest() {
        Map<String, List<?>> grid = new LinkedHashMap<>();
        grid.put("a", List.of(1, 2));
        grid.put("b", List.of(10, 20));

        List<Map<String, Object>> combos = ParameterGrid.of(grid).combinations();

        assertEquals(List.of(
                Map.of("a", 1, "b", 10),
                Map.of("a", 1, "b", 20),
                Map.of("a", 2, "b", 10),
                Map.of("a", 2, "b", 20)), combos);
    }

    @Test
    void sizeIsProductOfValueCounts() {
        Map<String, List<?>> grid = new LinkedHashMap<>();
        grid.put("mesh", List.of(16, 32, 64));
        grid.put("solver", List.of("cg", "gmres"));
        grid.put("tol", List.of(1e-6));

        ParameterGrid p = ParameterGrid.of(grid);

        assertEquals(6, p.size());
        assertEquals(6, p.combinations().size());
    }

    @Test
    void emptyGridYieldsSingleEmptyCombination() {
        assertEquals(List.of(Map.of()), ParameterGrid.of(Map.of()).combinations());
    }

    @Test
    void emptyValueListIsRejected() {
        assertThrows(SubmissionException.class, () -> ParameterGrid.of(Map.of("a", List.of())));
    }
}
