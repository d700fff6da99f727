package dk.cloudcreate.aggregatestore.common.transaction;

import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Keeps track of the {@link UnitOfWork} participants enlisted in a {@link UnitOfWorkContext} and flushes them.<br>
 * Enlistment is idempotent (reference identity). Flushing happens in rounds: every round flushes, in enlistment order,
 * the participants enlisted since the previous round that report {@link UnitOfWork#requiresFlush()}. Participants
 * enlisted while a round is running are picked up by the next round. A participant is flushed at most once.
 */
public final class UnitOfWorkController {
    private static final Logger log = LoggerFactory.getLogger(UnitOfWorkController.class);

    private final String           unitOfWorkContextId;
    private final List<UnitOfWork> pendingUnitsOfWork;
    private final Set<UnitOfWork>  enlistedUnitsOfWork;
    private final Set<UnitOfWork>  flushedUnitsOfWork;

    public UnitOfWorkController(String unitOfWorkContextId) {
        this.unitOfWorkContextId = requireNonNull(unitOfWorkContextId, "No unitOfWorkContextId provided");
        this.pendingUnitsOfWork = new ArrayList<>();
        this.enlistedUnitsOfWork = Collections.newSetFromMap(new IdentityHashMap<>());
        this.flushedUnitsOfWork = Collections.newSetFromMap(new IdentityHashMap<>());
    }

    /**
     * Enlist a participant
     *
     * @param unitOfWork the participant
     * @return true if the participant was enlisted, false if it was already enlisted
     */
    public boolean enlist(UnitOfWork unitOfWork) {
        requireNonNull(unitOfWork, "No unitOfWork provided");
        if (enlistedUnitsOfWork.add(unitOfWork)) {
            log.debug("[{}] Enlisted '{}'", unitOfWorkContextId, unitOfWork.getClass().getName());
            pendingUnitsOfWork.add(unitOfWork);
            return true;
        }
        return false;
    }

    public boolean isEnlisted(UnitOfWork unitOfWork) {
        return enlistedUnitsOfWork.contains(unitOfWork);
    }

    /**
     * Number of participants enlisted so far
     */
    public int enlistedCount() {
        return enlistedUnitsOfWork.size();
    }

    /**
     * Does any enlisted, not yet flushed, participant require a flush
     */
    public boolean requiresFlush() {
        return pendingUnitsOfWork.stream().anyMatch(UnitOfWork::requiresFlush);
    }

    /**
     * Flush all participants that require it. The first failure stops the flush and is rethrown as is.
     */
    public void flush() {
        var round = 0;
        while (!pendingUnitsOfWork.isEmpty()) {
            var unitsOfWork = new ArrayList<>(pendingUnitsOfWork);
            pendingUnitsOfWork.clear();
            round++;
            log.trace("[{}] Flush round {} covering {} participant(s)", unitOfWorkContextId, round, unitsOfWork.size());
            for (var unitOfWork : unitsOfWork) {
                if (!flushedUnitsOfWork.add(unitOfWork)) {
                    continue;
                }
                if (unitOfWork.requiresFlush()) {
                    log.debug("[{}] Flushing '{}'", unitOfWorkContextId, unitOfWork.getClass().getName());
                    unitOfWork.flush();
                } else {
                    log.trace("[{}] '{}' doesn't require a flush", unitOfWorkContextId, unitOfWork.getClass().getName());
                }
            }
        }
    }
}
