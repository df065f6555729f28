package com.questrail.disttest.junit;

import com.questrail.disttest.api.DistributedRuntime;
import com.questrail.disttest.api.TestContext;
import com.questrail.disttest.api.TestIdentity;
import com.questrail.disttest.error.ConfigurationException;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DistributedTestExtensionTest {

    @DistributedTest
    void contextParameterCarriesALiveRuntime(TestContext context) {
        assertEquals(0, context.rank());
        assertEquals(1, context.worldSize());
        assertEquals("worker0", context.runtime().selfName());
        assertFalse(context.runtime().communication().isClosed());
        assertTrue(Files.isDirectory(context.rendezvousFile().getParent()));
    }

    @DistributedTest
    void runtimeParameterIsBoundForTheMethod(DistributedRuntime runtime) {
        assertEquals(0, runtime.rank());
        assertEquals(1, runtime.rpc().workers().size());
        assertEquals(runtime.descriptor(), runtime.communication().descriptor());
    }

    @Test
    void identityDefaultsToASingleRank() {
        assertEquals(TestIdentity.single(), DistributedTestExtension.identity(key -> null));
    }

    @Test
    void identityIsReadFromProperties() {
        Map<String, String> props = Map.of(
                DistributedTestExtension.RANK_PROPERTY, "2",
                DistributedTestExtension.WORLD_SIZE_PROPERTY, " 4 ");

        assertEquals(new TestIdentity(2, 4), DistributedTestExtension.identity(props::get));
    }

    @Test
    void badIdentityPropertiesAreConfigurationErrors() {
        assertThrows(ConfigurationException.class, () -> DistributedTestExtension.identity(
                Map.of(DistributedTestExtension.RANK_PROPERTY, "zero")::get));
        assertThrows(ConfigurationException.class, () -> DistributedTestExtension.identity(
                Map.of(DistributedTestExtension.RANK_PROPERTY, "3", DistributedTestExtension.WORLD_SIZE_PROPERTY, "2")::get));
    }

    @Test
    void fileNamesAreSafeStableAndDistinct() {
        String id = "[engine:junit-jupiter]/[class:a.B]/[method:m(com.x.TestContext)]";

        String name = DistributedTestExtension.fileNameFor(id);

        assertEquals(name, DistributedTestExtension.fileNameFor(id));
        assertTrue(name.startsWith("rdzv-"));
        assertTrue(name.matches("[A-Za-z0-9._-]+"), name);
        assertNotEquals(name, DistributedTestExtension.fileNameFor(id.replace("m(", "n(")));
        assertTrue(DistributedTestExtension.fileNameFor("x".repeat(500)).length() < 140);
    }

    @Test
    void runtimeOutsideTheMethodIsUnavailable() {
        BoundRuntime bound = new BoundRuntime();

        assertThrows(IllegalStateException.class, bound::rpc);
    }
}
