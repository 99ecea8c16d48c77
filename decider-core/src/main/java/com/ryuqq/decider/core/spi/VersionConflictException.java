package com.ryuqq.decider.core.spi;

/**
 * Thrown by locking repositories when the expected version is stale.
 *
 * <p>The caller should re-fetch, re-decide and try again.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class VersionConflictException extends RuntimeException {

    private final transient Object expectedVersion;
    private final transient Object actualVersion;

    /**
     * Creates a conflict for the given versions.
     *
     * @param expectedVersion the version the writer expected, may be null
     * @param actualVersion the version currently stored, may be null
     */
    public VersionConflictException(Object expectedVersion, Object actualVersion) {
        super("Version conflict: expected " + expectedVersion + " but was " + actualVersion);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public Object expectedVersion() {
        return expectedVersion;
    }

    public Object actualVersion() {
        return actualVersion;
    }
}
