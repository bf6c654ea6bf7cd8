package com.questrail.crossval.config;

import com.questrail.crossval.api.Participant;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Aggregated configuration for one cross-validation session.
 *
 * <h2>Environment</h2>
 * {@link #fromEnvironment(Map)} reads:
 * <ul>
 *   <li>{@value #ENV_INSTANCE_ID} (required)</li>
 *   <li>{@value #ENV_NUM_INSTANCES} (required, 1 to 4)</li>
 *   <li>{@value #ENV_SERVER_ADDR} (default {@value #DEFAULT_SERVER_ADDR})</li>
 *   <li>{@value #ENV_SERVER_PORT} (default {@value #DEFAULT_SERVER_PORT}; non-positive,
 *       out of range or unparsable values fall back to the default)</li>
 *   <li>{@value #ENV_TRANSPORT} ({@code socket} or {@code shm}, default {@code socket})</li>
 *   <li>{@value #ENV_SEGMENT_PATH} (default {@code ${java.io.tmpdir}/crossval-segment})</li>
 * </ul>
 */
public record CrossValidationConfig(
    Participant participant,
    String serverAddress,
    int serverPort,
    TransportKind transport,
    Path segmentPath,
    ValidationTimingPolicy timing
) {
    public static final String ENV_INSTANCE_ID = "CROSS_VALIDATION_INSTANCE_ID";
    public static final String ENV_NUM_INSTANCES = "CROSS_VALIDATION_NUM_INSTANCES";
    public static final String ENV_SERVER_ADDR = "CROSS_VALIDATION_SERVER_ADDR";
    public static final String ENV_SERVER_PORT = "CROSS_VALIDATION_SERVER_PORT";
    public static final String ENV_TRANSPORT = "CROSS_VALIDATION_TRANSPORT";
    public static final String ENV_SEGMENT_PATH = "CROSS_VALIDATION_SEGMENT_PATH";

    public static final String DEFAULT_SERVER_ADDR = "0.0.0.0";
    public static final int DEFAULT_SERVER_PORT = 5000;

    private static final String SEGMENT_FILE_NAME = "crossval-segment";

    public CrossValidationConfig {
        Objects.requireNonNull(participant, "participant");
        Objects.requireNonNull(serverAddress, "serverAddress");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(segmentPath, "segmentPath");
        Objects.requireNonNull(timing, "timing");
        if (serverPort < 0 || serverPort > 65535) {
            throw new IllegalArgumentException("serverPort must be in range 0-65535 (was " + serverPort + ")");
        }
    }

    /**
     * Address the coordinator binds.
     */
    public InetSocketAddress bindAddress() {
        return new InetSocketAddress(serverAddress, serverPort);
    }

    /**
     * Address participants connect to. A wildcard bind address is not
     * connectable, so it maps to the loopback address.
     */
    public InetSocketAddress coordinatorAddress() {
        InetSocketAddress bind = bindAddress();
        InetAddress host = bind.getAddress();
        if (host == null || host.isAnyLocalAddress()) {
            return new InetSocketAddress(InetAddress.getLoopbackAddress(), serverPort);
        }
        return bind;
    }

    /**
     * Copy of this configuration bound to another port. The session uses it
     * when the coordinator was started on an ephemeral port.
     */
    public CrossValidationConfig withServerPort(int port) {
        return new CrossValidationConfig(participant, serverAddress, port, transport, segmentPath, timing);
    }

    /**
     * Builds a configuration from environment variables.
     *
     * @param env typically {@code System.getenv()}
     * @throws IllegalArgumentException if a required variable is missing or malformed
     */
    public static CrossValidationConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");

        int instanceId = requireInt(env, ENV_INSTANCE_ID);
        int instanceCount = requireInt(env, ENV_NUM_INSTANCES);

        Builder b = builder().withParticipant(new Participant(instanceId, instanceCount));

        String addr = env.get(ENV_SERVER_ADDR);
        if (addr != null && !addr.isBlank()) {
            b.withServerAddress(addr.trim());
        }
        b.withServerPort(parsePort(env.get(ENV_SERVER_PORT)));

        String transport = env.get(ENV_TRANSPORT);
        if (transport != null && !transport.isBlank()) {
            b.withTransport(TransportKind.fromName(transport));
        }

        String segment = env.get(ENV_SEGMENT_PATH);
        if (segment != null && !segment.isBlank()) {
            b.withSegmentPath(Paths.get(segment.trim()));
        }

        return b.build();
    }

    static int parsePort(String value) {
        if (value == null) {
            return DEFAULT_SERVER_PORT;
        }
        try {
            int port = Integer.parseInt(value.trim());
            return port > 0 && port <= 65535 ? port : DEFAULT_SERVER_PORT;
        } catch (NumberFormatException e) {
            return DEFAULT_SERVER_PORT;
        }
    }

    private static int requireInt(Map<String, String> env, String name) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is not set");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer (was '" + value + "')", e);
        }
    }

    public static Path defaultSegmentPath() {
        return Paths.get(System.getProperty("java.io.tmpdir"), SEGMENT_FILE_NAME);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Participant participant;
        private String serverAddress = DEFAULT_SERVER_ADDR;
        private int serverPort = DEFAULT_SERVER_PORT;
        private TransportKind transport = TransportKind.SOCKET;
        private Path segmentPath = defaultSegmentPath();
        private ValidationTimingPolicy timing = ValidationTimingPolicy.defaults();

        public Builder withParticipant(Participant participant) {
            this.participant = participant;
            return this;
        }

        public Builder withServerAddress(String serverAddress) {
            this.serverAddress = serverAddress;
            return this;
        }

        public Builder withServerPort(int serverPort) {
            this.serverPort = serverPort;
            return this;
        }

        public Builder withTransport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder withSegmentPath(Path segmentPath) {
            this.segmentPath = segmentPath;
            return this;
        }

        public Builder withTiming(ValidationTimingPolicy timing) {
            this.timing = timing;
            return this;
        }

        public CrossValidationConfig build() {
            return new CrossValidationConfig(participant, serverAddress, serverPort, transport, segmentPath, timing);
        }
    }
}
