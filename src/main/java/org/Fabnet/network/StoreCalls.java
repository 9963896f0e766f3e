package org.Fabnet.network;

import lombok.experimental.UtilityClass;

import java.util.function.Supplier;

/**
 * Guard for backing-store calls: store failures surface as {@code BACKING_STORE_UNAVAILABLE}.
 */
@UtilityClass
public class StoreCalls {

    /**
     * Runs {@code call}, rethrowing analysis exceptions as-is and wrapping any other runtime failure.
     */
    public <T> T query(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (NetworkAnalysisException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw NetworkAnalysisException.storeUnavailable(operation, ex);
        }
    }
}
