package com.eainde.policyaudit.insight;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Reading or flushing the persistent insight store failed. */
public class InsightStoreException extends UncheckedIOException {

    public InsightStoreException(String message, IOException cause) {
        super(message, cause);
    }
}
