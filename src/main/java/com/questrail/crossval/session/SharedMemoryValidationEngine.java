package com.questrail.crossval.session;

import com.questrail.crossval.api.Fingerprint;
import com.questrail.crossval.api.ValidationOutcome;
import com.questrail.crossval.shm.SharedMemoryValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Shared-memory transport. There are no peers to notify, so shutdown and
 * abandon both just close the segment.
 */
final class SharedMemoryValidationEngine implements ValidationEngine
{
    private static final Logger log = LoggerFactory.getLogger(SharedMemoryValidationEngine.class);

    private final SharedMemoryValidator validator;

    SharedMemoryValidationEngine(SharedMemoryValidator validator) {
        this.validator = validator;
    }

    @Override
    public ValidationOutcome validate(int syncPoint, int pointOrdinal, Fingerprint fingerprint) {
        return validator.validate(syncPoint, fingerprint);
    }

    @Override
    public boolean validationFailed() {
        return validator.validationFailed();
    }

    @Override
    public String mismatchDetail() {
        return validator.mismatchDetail();
    }

    @Override
    public void abandon() {
        close();
    }

    @Override
    public void shutdown() {
        close();
    }

    private void close() {
        try {
            validator.close();
        } catch (IOException e) {
            log.warn("Failed to close shared segment: {}", e.toString());
        }
    }
}
