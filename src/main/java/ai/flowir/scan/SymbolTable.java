package ai.flowir.scan;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Index-wide symbol table for light resolution:
 * - fqcn -> exists
 * - simpleName -> fqcn (only if unique)
 */
public final class SymbolTable {

    private final Set<String> allFqcns = new HashSet<>();
    private final Map<String, String> uniqueSimpleToFqcn = new HashMap<>();
    private final Map<String, Integer> simpleCounts = new HashMap<>();

    public void registerType(String fqcn) {
        if (!allFqcns.add(fqcn)) {
            return;
        }
        final String simple = simpleNameOfFqcn(fqcn);
        simpleCounts.put(simple, simpleCounts.getOrDefault(simple, 0) + 1);
    }

    public void finalizeIndex() {
        uniqueSimpleToFqcn.clear();
        for (String fqcn : allFqcns) {
            final String simple = simpleNameOfFqcn(fqcn);
            if (simpleCounts.getOrDefault(simple, 0) == 1) {
                uniqueSimpleToFqcn.put(simple, fqcn);
            }
        }
    }

    /**
     * @return the known fqcn for a fully qualified or uniquely named simple type, else null
     */
    public String resolveToFqcnIfPossible(String typeName) {
        if (typeName == null || typeName.isBlank()) return null;

        final String trimmed = typeName.trim();
        if (allFqcns.contains(trimmed)) return trimmed;
        if (trimmed.indexOf('.') >= 0) return null;

        return uniqueSimpleToFqcn.get(trimmed);
    }

    static String simpleNameOfFqcn(String fqcn) {
        final int i = fqcn.lastIndexOf('.');
        return i >= 0 ? fqcn.substring(i + 1) : fqcn;
    }
}
