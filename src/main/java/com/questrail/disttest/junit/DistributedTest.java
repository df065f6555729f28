package com.questrail.disttest.junit;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a test method that runs inside a distributed runtime.
 *
 * <p>The multi-process runner starts one JVM per rank and passes the identity
 * through system properties (see {@link DistributedTestExtension}). Every rank
 * runs the same test methods; each method gets its own rendezvous and its own
 * communication and RPC contexts, torn down when the method returns.</p>
 *
 * <p>Methods may declare {@link com.questrail.disttest.api.TestContext} or
 * {@link com.questrail.disttest.api.DistributedRuntime} parameters.</p>
 */
@Target({ElementType.METHOD, ElementType.ANNOTATION_TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Test
@ExtendWith(DistributedTestExtension.class)
public @interface DistributedTest {}
