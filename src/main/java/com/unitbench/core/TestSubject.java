package com.unitbench.core;

import java.util.List;

/**
 * The capabilities a {@link TestRunner} needs from the object under test.
 *
 * {@link UnitTestCase} implements all of them; a custom subject can implement
 * this interface directly.
 */
public interface TestSubject {

    /** Runs before every test method. */
    void setUp() throws Exception;

    /** Runs after every test method, whether it passed, failed or skipped. */
    void tearDown() throws Exception;

    /** Runs once before any test method; raising a skip signal skips the whole run. */
    void skip() throws Exception;

    /** Names of the test methods to run when none are given explicitly. */
    List<String> testMethods();

    /**
     * Invokes one test method by name.
     *
     * @throws Throwable whatever the method body raised, unwrapped from reflection
     */
    void invoke(String method) throws Throwable;
}
