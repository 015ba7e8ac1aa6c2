package com.outbound.routing.adapters.out.postgres;

import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import com.outbound.routing.application.port.out.TransactionRunner;
import com.outbound.routing.domain.exception.StoreUnavailableException;

/**
 * Runs application units of work in a Spring-managed JDBC transaction.
 * <p>
 * Connection-level failures surface as {@link StoreUnavailableException} so
 * callers can tell "retry later" apart from bad input.
 * </p>
 */
@Component
public class SpringTransactionRunner implements TransactionRunner {

    private static final Logger log = LoggerFactory.getLogger(SpringTransactionRunner.class);

    private final TransactionTemplate transactionTemplate;

    public SpringTransactionRunner(PlatformTransactionManager transactionManager) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        try {
            return transactionTemplate.execute(status -> work.get());
        } catch (DataAccessResourceFailureException | TransientDataAccessException
                | CannotCreateTransactionException e) {
            log.warn("action=store_unavailable error={}", e.getMessage());
            throw new StoreUnavailableException("Routing store unavailable", e);
        }
    }
}
