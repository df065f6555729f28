package com.questrail.disttest.junit;

import com.questrail.disttest.api.DistributedRuntime;
import com.questrail.disttest.api.TestContext;
import com.questrail.disttest.api.TestIdentity;
import com.questrail.disttest.error.ConfigurationException;
import com.questrail.disttest.harness.DistributedTestHarnessFactory;
import com.questrail.disttest.harness.RendezvousHarness;

import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.InvocationInterceptor;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.junit.jupiter.api.extension.ReflectiveInvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Method;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * DistributedTestExtension
 * =============================================================================
 * JUnit Jupiter extension behind {@link DistributedTest}. It runs each test
 * method through the process's {@link RendezvousHarness}.
 *
 * <h2>Identity</h2>
 * Supplied by the multi-process runner as system properties:
 * <ul>
 *   <li>{@value #RANK_PROPERTY} - default {@code 0}</li>
 *   <li>{@value #WORLD_SIZE_PROPERTY} - default {@code 1}</li>
 *   <li>{@value #RENDEZVOUS_DIR_PROPERTY} - shared directory; required when the
 *       world size is greater than one</li>
 * </ul>
 * Each test method rendezvouses on its own file inside the shared directory,
 * named after the method's unique id, so every rank derives the same path.
 * Without a shared directory (single rank) a temporary directory is created
 * and removed after the method.
 *
 * <h2>Harness</h2>
 * One harness per JVM, built from the environment on first use and kept in
 * the root extension store.
 */
public final class DistributedTestExtension implements InvocationInterceptor, ParameterResolver
{
    private static final Logger log = LoggerFactory.getLogger(DistributedTestExtension.class);

    public static final String RANK_PROPERTY = "disttest.rank";
    public static final String WORLD_SIZE_PROPERTY = "disttest.worldSize";
    public static final String RENDEZVOUS_DIR_PROPERTY = "disttest.rendezvousDir";

    private static final ExtensionContext.Namespace NAMESPACE =
            ExtensionContext.Namespace.create(DistributedTestExtension.class);

    private static final String HARNESS_KEY = "harness";
    private static final String CONTEXT_KEY = "context";
    private static final String RUNTIME_KEY = "runtime";

    @Override
    public void interceptTestMethod(Invocation<Void> invocation,
                                    ReflectiveInvocationContext<Method> invocationContext,
                                    ExtensionContext extensionContext) throws Throwable
    {
        RendezvousHarness harness = harness(extensionContext);
        TestContext context = testContext(extensionContext);
        BoundRuntime bound = boundRuntime(extensionContext);

        harness.run(context, ctx -> {
            bound.bind(ctx.runtime());
            try {
                invocation.proceed();
            } catch (Exception | Error e) {
                throw e;
            } catch (Throwable t) {
                throw new IllegalStateException("Test method threw a non-standard throwable", t);
            } finally {
                bound.unbind();
            }
            return null;
        });
    }

    @Override
    public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {
        Class<?> type = parameterContext.getParameter().getType();
        return type == TestContext.class || type == DistributedRuntime.class;
    }

    @Override
    public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext)
    {
        Class<?> type = parameterContext.getParameter().getType();
        BoundRuntime bound = boundRuntime(extensionContext);
        if (type == DistributedRuntime.class) {
            return bound;
        }
        return testContext(extensionContext).withRuntime(bound);
    }

    // -------------------------------------------------------------------------
    // Store-backed state
    // -------------------------------------------------------------------------

    private static RendezvousHarness harness(ExtensionContext ec)
    {
        return ec.getRoot().getStore(NAMESPACE).getOrComputeIfAbsent(
                HARNESS_KEY, k -> DistributedTestHarnessFactory.fromEnvironment(), RendezvousHarness.class);
    }

    private static BoundRuntime boundRuntime(ExtensionContext ec)
    {
        return ec.getStore(NAMESPACE).getOrComputeIfAbsent(RUNTIME_KEY, k -> new BoundRuntime(), BoundRuntime.class);
    }

    private static TestContext testContext(ExtensionContext ec)
    {
        ExtensionContext.Store store = ec.getStore(NAMESPACE);
        TestContext existing = store.get(CONTEXT_KEY, TestContext.class);
        if (existing != null) {
            return existing;
        }
        TestIdentity identity = identity(System::getProperty);
        Path file = rendezvousFile(ec, identity, System.getProperty(RENDEZVOUS_DIR_PROPERTY));
        TestContext context = TestContext.of(identity, file);
        store.put(CONTEXT_KEY, context);
        return context;
    }

    static TestIdentity identity(Function<String, String> properties)
    {
        return new TestIdentity(
                intProperty(properties, RANK_PROPERTY, 0),
                intProperty(properties, WORLD_SIZE_PROPERTY, 1));
    }

    private static int intProperty(Function<String, String> properties, String name, int fallback)
    {
        String raw = properties.apply(name);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("System property " + name + " must be an integer, was '" + raw + "'", e);
        }
    }

    private static Path rendezvousFile(ExtensionContext ec, TestIdentity identity, String sharedDir)
    {
        String fileName = fileNameFor(ec.getUniqueId());
        if (sharedDir != null && !sharedDir.isBlank()) {
            return Paths.get(sharedDir).toAbsolutePath().resolve(fileName);
        }
        if (identity.worldSize() > 1) {
            throw new ConfigurationException(RENDEZVOUS_DIR_PROPERTY
                    + " must name a directory shared by all ranks when worldSize > 1");
        }

        try {
            Path dir = Files.createTempDirectory("disttest-");
            ec.getStore(NAMESPACE).put("tempDir", new TempDirectory(dir));
            return dir.resolve(fileName);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create a rendezvous directory", e);
        }
    }

    static String fileNameFor(String uniqueId)
    {
        StringBuilder sb = new StringBuilder("rdzv-");
        for (char ch : uniqueId.toCharArray()) {
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9') || ch == '.' || ch == '-' || ch == '_';
            sb.append(ok ? ch : '_');
        }
        if (sb.length() > 120) {
            sb.setLength(120);
        }
        return sb.append('-').append(Integer.toHexString(uniqueId.hashCode())).toString();
    }

    /**
     * Removes the per-method temporary directory when the method's store closes.
     */
    private record TempDirectory(Path dir) implements ExtensionContext.Store.CloseableResource
    {
        @Override
        public void close() throws IOException
        {
            try (Stream<Path> paths = Files.walk(dir)) {
                for (Path p : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.deleteIfExists(p);
                }
            }
            log.debug("Removed rendezvous directory {}", dir);
        }
    }
}
