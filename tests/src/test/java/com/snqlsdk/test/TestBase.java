package com.snqlsdk.test;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class for snql-sdk tests.
 *
 * <p>Logs the start and end of every test and offers {@link #logStep(String)}
 * and {@link #logData(String, Object)} for given/when/then narration.
 * Subclasses override {@link #doSetUp()} and {@link #doTearDown()} instead of
 * declaring their own lifecycle methods.
 */
public abstract class TestBase {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private String testName;

    @BeforeEach
    void setUpBase(TestInfo testInfo) {
        testName = testInfo.getDisplayName();
        logger.debug("Starting test: {}", testName);
        doSetUp();
    }

    @AfterEach
    void tearDownBase() {
        doTearDown();
        logger.debug("Finished test: {}", testName);
    }

    protected void doSetUp() {
    }

    protected void doTearDown() {
    }

    protected void logStep(String step) {
        logger.debug("  {}", step);
    }

    protected void logData(String label, Object value) {
        logger.debug("  {}: {}", label, value);
    }
}
