package io.homefinder.index;

import io.homefinder.core.IndexConfiguration;
import io.homefinder.storage.PropertyStore;

import java.util.List;

/**
 * Inverted index over a {@link PropertyStore}: attribute, then key, then the
 * ids of the properties holding that key.
 * <p>
 * Implementations are immutable once built and safe for concurrent queries.
 */
public interface PropertyIndex {

    /**
     * Short name used in logs and statistics.
     */
    String name();

    /**
     * Store the index was built from; ids returned by {@link #evaluate(List)} refer to it.
     */
    PropertyStore store();

    IndexConfiguration configuration();

    /**
     * Ids of the properties satisfying every predicate, ascending.
     * <p>
     * An empty predicate list matches every property. A predicate with no
     * matching key ends the evaluation before any union or intersection.
     */
    IndexEvaluation evaluate(List<AttributeRange> predicates);

    IndexStatistics statistics();
}
