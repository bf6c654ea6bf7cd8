package com.questrail.crossval.config;

import org.junit.jupiter.api.Test;

import java.net.InetSocketAddress;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class CrossValidationConfigTest {

    private static Map<String, String> env(int id, int count) {
        Map<String, String> env = new HashMap<>();
        env.put(CrossValidationConfig.ENV_INSTANCE_ID, Integer.toString(id));
        env.put(CrossValidationConfig.ENV_NUM_INSTANCES, Integer.toString(count));
        return env;
    }

    @Test
    void environmentWithOnlyRequiredVariablesUsesDefaults() {
        CrossValidationConfig c = CrossValidationConfig.fromEnvironment(env(1, 2));

        assertEquals(1, c.participant().instanceId());
        assertEquals(2, c.participant().instanceCount());
        assertEquals("0.0.0.0", c.serverAddress());
        assertEquals(5000, c.serverPort());
        assertEquals(TransportKind.SOCKET, c.transport());
        assertEquals(CrossValidationConfig.defaultSegmentPath(), c.segmentPath());
        assertEquals(ValidationTimingPolicy.defaults(), c.timing());
    }

    @Test
    void optionalVariablesOverrideDefaults() {
        Map<String, String> env = env(0, 3);
        env.put(CrossValidationConfig.ENV_SERVER_ADDR, " 10.0.0.7 ");
        env.put(CrossValidationConfig.ENV_SERVER_PORT, "6001");
        env.put(CrossValidationConfig.ENV_TRANSPORT, "SHM");
        env.put(CrossValidationConfig.ENV_SEGMENT_PATH, "/dev/shm/water");

        CrossValidationConfig c = CrossValidationConfig.fromEnvironment(env);

        assertEquals("10.0.0.7", c.serverAddress());
        assertEquals(6001, c.serverPort());
        assertEquals(TransportKind.SHM, c.transport());
        assertEquals(Paths.get("/dev/shm/water"), c.segmentPath());
    }

    @Test
    void missingRequiredVariableIsRejected() {
        Map<String, String> env = env(0, 2);
        env.remove(CrossValidationConfig.ENV_NUM_INSTANCES);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> CrossValidationConfig.fromEnvironment(env));
        assertTrue(e.getMessage().contains(CrossValidationConfig.ENV_NUM_INSTANCES));
    }

    @Test
    void malformedOrOutOfRangeIdsAreRejected() {
        Map<String, String> env = env(0, 2);
        env.put(CrossValidationConfig.ENV_INSTANCE_ID, "zero");
        assertThrows(IllegalArgumentException.class, () -> CrossValidationConfig.fromEnvironment(env));

        assertThrows(IllegalArgumentException.class, () -> CrossValidationConfig.fromEnvironment(env(2, 2)));
        assertThrows(IllegalArgumentException.class, () -> CrossValidationConfig.fromEnvironment(env(0, 5)));
    }

    @Test
    void unusablePortFallsBackToDefault() {
        assertEquals(5000, CrossValidationConfig.parsePort(null));
        assertEquals(5000, CrossValidationConfig.parsePort("http"));
        assertEquals(5000, CrossValidationConfig.parsePort("0"));
        assertEquals(5000, CrossValidationConfig.parsePort("-4"));
        assertEquals(5000, CrossValidationConfig.parsePort("70000"));
        assertEquals(7000, CrossValidationConfig.parsePort(" 7000 "));
    }

    @Test
    void unknownTransportIsRejected() {
        Map<String, String> env = env(0, 2);
        env.put(CrossValidationConfig.ENV_TRANSPORT, "rdma");
        assertThrows(IllegalArgumentException.class, () -> CrossValidationConfig.fromEnvironment(env));
    }

    @Test
    void wildcardBindAddressIsReachedThroughLoopback() {
        CrossValidationConfig c = CrossValidationConfig.fromEnvironment(env(1, 2));

        InetSocketAddress target = c.coordinatorAddress();
        assertTrue(target.getAddress().isLoopbackAddress());
        assertEquals(5000, target.getPort());
        assertTrue(c.bindAddress().getAddress().isAnyLocalAddress());
    }

    @Test
    void specificBindAddressIsUsedAsIs() {
        CrossValidationConfig c = CrossValidationConfig.fromEnvironment(env(1, 2)).withServerPort(0);
        CrossValidationConfig specific = CrossValidationConfig.builder()
                .withParticipant(c.participant())
                .withServerAddress("127.0.0.1")
                .withServerPort(6100)
                .build();

        assertEquals(new InetSocketAddress("127.0.0.1", 6100), specific.coordinatorAddress());
        assertEquals(0, c.serverPort());
    }
}
