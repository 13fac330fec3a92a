package com.openrangelabs.ingestor;

import org.junit.platform.suite.api.SelectPackages;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Test suite for running all data ingestor tests
 *
 * Usage:
 * - Run all tests: mvn test
 * - Run specific suite: mvn test -Dtest=TestSuite
 */
@Suite
@SuiteDisplayName("Data Ingestor Test Suite")
@SelectPackages({
    "com.openrangelabs.ingestor.model",
    "com.openrangelabs.ingestor.connector",
    "com.openrangelabs.ingestor.extraction",
    "com.openrangelabs.ingestor.transformation",
    "com.openrangelabs.ingestor.registry",
    "com.openrangelabs.ingestor.service",
    "com.openrangelabs.ingestor.scheduler",
    "com.openrangelabs.ingestor.notification",
    "com.openrangelabs.ingestor.controller",
    "com.openrangelabs.ingestor.integration"
})
public class TestSuite {
    // JUnit 5 discovers and runs all tests in the selected packages
}
