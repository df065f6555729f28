/**
 * Per-Test Rendezvous Harness
 * =============================================================================
 *
 * <p>{@link com.questrail.disttest.harness.RendezvousHarness} brackets a test
 * body with collective setup and guaranteed teardown of the two distributed
 * layers:</p>
 * <ol>
 *   <li>the communication context, rendezvousing on a shared file</li>
 *   <li>the RPC context layered on it, with workers named {@code worker<rank>}</li>
 * </ol>
 *
 * <p>Every participating process runs the same test with its own rank. The
 * wiring of concrete transports lives in
 * {@link com.questrail.disttest.harness.DistributedTestHarnessFactory}.</p>
 */
package com.questrail.disttest.harness;
