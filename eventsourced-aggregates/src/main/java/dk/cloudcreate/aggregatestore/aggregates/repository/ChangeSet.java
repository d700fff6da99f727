package dk.cloudcreate.aggregatestore.aggregates.repository;

import dk.cloudcreate.aggregatestore.aggregates.serialization.AggregateWriteSet;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * All changes a {@link Repository} writes to storage in a single flush. Each list keeps the order in which the
 * aggregates were first tracked
 *
 * @param <ID>      the aggregate id type
 * @param <VERSION> the aggregate version type
 */
public final class ChangeSet<ID, VERSION extends Comparable<VERSION>> {
    private final List<AggregateWriteSet<ID, VERSION>> aggregatesToInsert;
    private final List<AggregateWriteSet<ID, VERSION>> aggregatesToUpdate;
    private final List<ID>                             aggregatesToDelete;

    public ChangeSet(List<AggregateWriteSet<ID, VERSION>> aggregatesToInsert,
                     List<AggregateWriteSet<ID, VERSION>> aggregatesToUpdate,
                     List<ID> aggregatesToDelete) {
        this.aggregatesToInsert = List.copyOf(requireNonNull(aggregatesToInsert, "No aggregatesToInsert provided"));
        this.aggregatesToUpdate = List.copyOf(requireNonNull(aggregatesToUpdate, "No aggregatesToUpdate provided"));
        this.aggregatesToDelete = List.copyOf(requireNonNull(aggregatesToDelete, "No aggregatesToDelete provided"));
    }

    public List<AggregateWriteSet<ID, VERSION>> aggregatesToInsert() {
        return aggregatesToInsert;
    }

    public List<AggregateWriteSet<ID, VERSION>> aggregatesToUpdate() {
        return aggregatesToUpdate;
    }

    public List<ID> aggregatesToDelete() {
        return aggregatesToDelete;
    }

    public boolean isEmpty() {
        return aggregatesToInsert.isEmpty() && aggregatesToUpdate.isEmpty() && aggregatesToDelete.isEmpty();
    }

    public int size() {
        return aggregatesToInsert.size() + aggregatesToUpdate.size() + aggregatesToDelete.size();
    }

    @Override
    public String toString() {
        return "ChangeSet{" +
                "inserts=" + aggregatesToInsert.size() +
                ", updates=" + aggregatesToUpdate.size() +
                ", deletes=" + aggregatesToDelete.size() +
                '}';
    }
}
