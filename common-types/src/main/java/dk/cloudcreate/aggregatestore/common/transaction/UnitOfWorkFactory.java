package dk.cloudcreate.aggregatestore.common.transaction;

import dk.cloudcreate.aggregatestore.common.bus.*;
import dk.cloudcreate.essentials.shared.functional.*;
import org.slf4j.*;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Starts {@link UnitOfWorkScope}'s and delivers the domain events released by successfully completed
 * {@link UnitOfWorkContext}'s to the registered subscribers.<br>
 * The {@link UnitOfWorkContext} is passed explicitly: a nested operation reuses its caller's context by calling
 * {@link #startUnitOfWorkScope(UnitOfWorkContext)} (or one of the <code>usingUnitOfWork</code>/<code>withUnitOfWork</code>
 * variants that take an existing context).
 */
public class UnitOfWorkFactory {
    private static final Logger unitOfWorkLog = LoggerFactory.getLogger(UnitOfWorkFactory.class);

    private final List<Consumer<PublishedDomainEvents>> subscribers = new CopyOnWriteArrayList<>();

    public UnitOfWorkFactory addDomainEventSubscriber(Consumer<PublishedDomainEvents> subscriber) {
        subscribers.add(requireNonNull(subscriber, "No subscriber provided"));
        return this;
    }

    public UnitOfWorkFactory removeDomainEventSubscriber(Consumer<PublishedDomainEvents> subscriber) {
        subscribers.remove(requireNonNull(subscriber, "No subscriber provided"));
        return this;
    }

    /**
     * Start a new owner scope with a new {@link UnitOfWorkContext}
     */
    public UnitOfWorkScope startUnitOfWorkScope() {
        var context = new UnitOfWorkContext();
        unitOfWorkLog.debug("[{}] Starting new UnitOfWork", context.id());
        return new UnitOfWorkScope(this, context, true);
    }

    /**
     * Start a nested scope that reuses <code>existingContext</code>. If <code>existingContext</code> is null
     * a new owner scope is started instead
     *
     * @param existingContext the context of the surrounding operation (may be null)
     * @return the scope
     * @throws UnitOfWorkException if <code>existingContext</code> has already been disposed
     */
    public UnitOfWorkScope startUnitOfWorkScope(UnitOfWorkContext existingContext) {
        if (existingContext == null) {
            return startUnitOfWorkScope();
        }
        if (existingContext.isDisposed()) {
            throw new UnitOfWorkException(msg("Cannot start a nested scope as the UnitOfWork '{}' has been disposed", existingContext.id()));
        }
        unitOfWorkLog.debug("[{}] NestedUnitOfWork: Reusing existing UnitOfWork", existingContext.id());
        return new UnitOfWorkScope(this, existingContext, false);
    }

    public void usingUnitOfWork(CheckedConsumer<UnitOfWorkContext> unitOfWorkConsumer) {
        usingUnitOfWork(null, unitOfWorkConsumer);
    }

    /**
     * Run <code>unitOfWorkConsumer</code> inside a scope. The scope is completed if the consumer returns normally
     * and is always closed.
     *
     * @param existingContext    the context to reuse or null to create a new one
     * @param unitOfWorkConsumer the work to perform
     * @throws UnitOfWorkException wrapping any failure (an existing {@link UnitOfWorkException} is rethrown as is)
     */
    public void usingUnitOfWork(UnitOfWorkContext existingContext, CheckedConsumer<UnitOfWorkContext> unitOfWorkConsumer) {
        requireNonNull(unitOfWorkConsumer, "No unitOfWorkConsumer provided");
        withUnitOfWork(existingContext, context -> {
            unitOfWorkConsumer.accept(context);
            return null;
        });
    }

    public <R> R withUnitOfWork(CheckedFunction<UnitOfWorkContext, R> unitOfWorkFunction) {
        return withUnitOfWork(null, unitOfWorkFunction);
    }

    /**
     * Run <code>unitOfWorkFunction</code> inside a scope and return its result. The scope is completed if the function
     * returns normally and is always closed.
     *
     * @param existingContext    the context to reuse or null to create a new one
     * @param unitOfWorkFunction the work to perform
     * @param <R>                the result type
     * @return the result of the function
     * @throws UnitOfWorkException wrapping any failure (an existing {@link UnitOfWorkException} is rethrown as is)
     */
    public <R> R withUnitOfWork(UnitOfWorkContext existingContext, CheckedFunction<UnitOfWorkContext, R> unitOfWorkFunction) {
        requireNonNull(unitOfWorkFunction, "No unitOfWorkFunction provided");
        try (var scope = startUnitOfWorkScope(existingContext)) {
            var result = unitOfWorkFunction.apply(scope.context());
            if (scope.isOwner()) {
                unitOfWorkLog.debug("[{}] Completing the UnitOfWork created by this withUnitOfWork method call", scope.context().id());
            }
            scope.complete();
            return result;
        } catch (UnitOfWorkException e) {
            throw e;
        } catch (Exception e) {
            throw new UnitOfWorkException(e);
        }
    }

    void deliver(PublishedDomainEvents publishedDomainEvents) {
        if (publishedDomainEvents.isEmpty()) {
            return;
        }
        for (var subscriber : subscribers) {
            try {
                subscriber.accept(publishedDomainEvents);
            } catch (RuntimeException e) {
                unitOfWorkLog.error(msg("Failed to deliver {} domain event(s) from UnitOfWork '{}' to subscriber {}",
                                        publishedDomainEvents.events().size(),
                                        publishedDomainEvents.unitOfWorkContextId,
                                        subscriber.getClass().getName()), e);
            }
        }
    }
}
