package com.e2eq.filter.model.persistent.morphia.query;

import com.e2eq.filter.model.query.FilterTree;
import org.bson.Document;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of running a client filter through read, sanitize and compile.
 *
 * @param query        native MongoDB filter, empty when nothing survived
 * @param tree         canonical tree the query was compiled from
 * @param violations   clause level problems, or a single fatal one when {@code failedClosed}
 * @param failedClosed a structural limit was breached and the whole filter was discarded
 */
public record CompiledFilter(Document query, FilterTree tree, List<String> violations, boolean failedClosed) {

    public CompiledFilter {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(tree, "tree");
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static CompiledFilter empty() {
        return new CompiledFilter(new Document(), FilterTree.EMPTY, List.of(), false);
    }

    public boolean isEmpty() {
        return query.isEmpty();
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
