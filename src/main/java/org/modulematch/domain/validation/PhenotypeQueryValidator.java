package org.modulematch.domain.validation;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Input checks for phenotype queries.
 */
public final class PhenotypeQueryValidator {

    private PhenotypeQueryValidator() {
    }

    public static void validateLabels(Collection<String> labels, String role) {
        if (labels == null) {
            return;
        }
        List<String> errors = new ArrayList<>();
        int position = 0;
        for (String label : labels) {
            if (label == null || label.isBlank()) {
                errors.add(role + " label at position " + position + " is blank");
            }
            position++;
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }
    }

    /**
     * A phenotype cannot be both present and absent in the same query.
     */
    public static void validateDisjoint(Set<String> observed, Set<String> excluded) {
        Set<String> overlap = new TreeSet<>(observed);
        overlap.retainAll(excluded);
        if (!overlap.isEmpty()) {
            throw new ValidationException("Phenotypes both observed and excluded: " + overlap);
        }
    }

    public static void validateTopN(int topN) {
        if (topN < 0) {
            throw new ValidationException("topN must not be negative: " + topN);
        }
    }
}
