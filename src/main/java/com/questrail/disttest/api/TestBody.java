package com.questrail.disttest.api;

/**
 * A test body run inside an initialized distributed runtime.
 *
 * <p>The harness returns a {@code TestBody} of the same shape, so wrapped
 * and unwrapped bodies are interchangeable at the call site.</p>
 *
 * @param <R> result type; use {@link Void} for bodies that only assert
 */
@FunctionalInterface
public interface TestBody<R>
{
    R run(TestContext context) throws Exception;
}
