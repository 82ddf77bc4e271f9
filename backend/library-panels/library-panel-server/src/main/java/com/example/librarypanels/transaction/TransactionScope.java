package com.example.librarypanels.transaction;

import com.example.librarypanels.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Runs a callback as one atomic unit of work. The callback receives the {@link TransactionStatus}
 * bound to that unit; returning normally commits, any exception rolls back and is rethrown
 * unchanged.
 *
 * <p>The request deadline becomes the transaction timeout. Spring JDBC applies the remaining time
 * to every statement, so a unit of work that outlives the deadline is aborted with
 * {@link TransactionTimedOutException}. A deadline that has already passed fails before any
 * connection is taken.
 */
@Component
public class TransactionScope {

    private static final Logger log = LoggerFactory.getLogger(TransactionScope.class);

    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTransactionTemplate;
    private final TransactionTemplate savepointTransactionTemplate;
    private final Clock clock;

    public TransactionScope(TransactionTemplate transactionTemplate,
                            @Qualifier("readOnlyTransactionTemplate") TransactionTemplate readOnlyTransactionTemplate,
                            @Qualifier("savepointTransactionTemplate") TransactionTemplate savepointTransactionTemplate,
                            Clock clock) {
        this.transactionTemplate = transactionTemplate;
        this.readOnlyTransactionTemplate = readOnlyTransactionTemplate;
        this.savepointTransactionTemplate = savepointTransactionTemplate;
        this.clock = clock;
    }

    public <T> T execute(RequestContext ctx, TransactionCallback<T> action) {
        return bind(transactionTemplate, ctx).execute(action);
    }

    public void executeWithoutResult(RequestContext ctx, Consumer<TransactionStatus> action) {
        bind(transactionTemplate, ctx).executeWithoutResult(action);
    }

    public <T> T executeReadOnly(RequestContext ctx, TransactionCallback<T> action) {
        return bind(readOnlyTransactionTemplate, ctx).execute(action);
    }

    /**
     * Runs the callback under a savepoint of the transaction already bound to the current thread.
     * A failure rolls back to the savepoint only and leaves the enclosing transaction usable.
     */
    public <T> T executeNested(TransactionCallback<T> action) {
        return savepointTransactionTemplate.execute(action);
    }

    private TransactionTemplate bind(TransactionTemplate template, RequestContext ctx) {
        Duration remaining = ctx.remaining(clock).orElse(null);
        if (remaining == null) {
            return template;
        }
        if (remaining.isNegative() || remaining.isZero()) {
            log.debug("Deadline {} already passed for orgId={}, userId={}", ctx.deadline(), ctx.orgId(), ctx.userId());
            throw new TransactionTimedOutException("Request deadline " + ctx.deadline() + " passed before the transaction started");
        }
        TransactionTemplate scoped = new TransactionTemplate(template.getTransactionManager(), template);
        scoped.setTimeout(toTimeoutSeconds(remaining));
        return scoped;
    }

    // Transaction timeouts are whole seconds; round up so a sub-second budget is not lost.
    static int toTimeoutSeconds(Duration remaining) {
        long seconds = remaining.getSeconds() + (remaining.getNano() > 0 ? 1 : 0);
        return (int) Math.min(Integer.MAX_VALUE, Math.max(1, seconds));
    }
}
