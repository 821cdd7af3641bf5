package com.gridsql.grid;

import com.gridsql.exception.RemoteAccessException;
import com.gridsql.logging.StatementLogger;
import java.util.function.Supplier;

/**
 * Runs a call against the {@link GridSource}, normalizing its failures.
 *
 * <p>A {@link RemoteAccessException} passes through untouched; any other runtime failure
 * is wrapped with the operation and location so callers see one error category.
 */
public final class RemoteCalls {

    private RemoteCalls() {}

    /**
     * Invokes a collaborator call.
     *
     * @param operation "read", "query", "write" or "metadata"
     * @param location the range involved
     * @param call the call
     * @param <T> the result type
     * @return the call's result
     * @throws RemoteAccessException if the call fails
     */
    public static <T> T invoke(String operation, String location, Supplier<T> call) {
        StatementLogger.logRemoteCall(operation, location);
        try {
            return call.get();
        } catch (RemoteAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new RemoteAccessException(operation, location, e);
        }
    }
}
