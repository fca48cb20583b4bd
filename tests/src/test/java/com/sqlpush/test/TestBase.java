package com.sqlpush.test;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for sqlpush tests.
 *
 * <p>Provides a per-class logger and helpers that tag log lines with the
 * running test's display name.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName = "";

    @BeforeEach
    void recordTestName(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
    }

    /**
     * Logs a Given/When/Then step of the running test.
     */
    protected void logStep(String step) {
        logger.debug("[{}] {}", testName, step);
    }

    /**
     * Logs a labelled value produced by the running test.
     */
    protected void logData(String label, Object data) {
        logger.debug("[{}] {}: {}", testName, label, data);
    }
}
