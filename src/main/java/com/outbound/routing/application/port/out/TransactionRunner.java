package com.outbound.routing.application.port.out;

import java.util.function.Supplier;

/**
 * Secondary (outbound) port: runs a unit of work atomically.
 * <p>
 * Any exception thrown by the work rolls back every store write made inside it
 * and is rethrown unchanged.
 * </p>
 */
public interface TransactionRunner {

    <T> T inTransaction(Supplier<T> work);
}
