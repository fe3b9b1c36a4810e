package com.questrail.adbemu.protocol.adb.config;

import com.questrail.adbemu.protocol.adb.codec.impl.AdbWireFormat;

import java.time.Duration;
import java.util.Objects;

/**
 * Aggregated configuration for an emulated daemon instance.
 *
 * @param addressFamily     loopback family to bind
 * @param port              port to bind; {@code 0} picks an ephemeral port
 * @param protocolVersion   {@code arg0} of the connect greeting
 * @param maxPayload        {@code arg1} of the connect greeting
 * @param banner            payload of the connect greeting
 * @param pullContent       file content returned for every RECV request
 * @param maxInboundPayload largest inbound {@code data_length} accepted before
 *                          the header is treated as malformed
 * @param maxSyncPathLength largest sync request path accepted
 * @param shutdownTimeout   upper bound on the graceful event-loop shutdown
 */
public record EmulatorConfig(
    AddressFamily addressFamily,
    int port,
    int protocolVersion,
    int maxPayload,
    String banner,
    String pullContent,
    int maxInboundPayload,
    int maxSyncPathLength,
    Duration shutdownTimeout
) {
    public static final String DEFAULT_BANNER = "device::";
    public static final String DEFAULT_PULL_CONTENT = "hello from fake adbd";
    public static final int DEFAULT_MAX_INBOUND_PAYLOAD = 1024 * 1024;
    public static final int DEFAULT_MAX_SYNC_PATH_LENGTH = 1024;

    public EmulatorConfig {
        Objects.requireNonNull(addressFamily, "addressFamily");
        Objects.requireNonNull(banner, "banner");
        Objects.requireNonNull(pullContent, "pullContent");
        Objects.requireNonNull(shutdownTimeout, "shutdownTimeout");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port must be 0-65535: " + port);
        }
        if (maxInboundPayload <= 0) {
            throw new IllegalArgumentException("maxInboundPayload must be positive");
        }
        if (maxSyncPathLength <= 0) {
            throw new IllegalArgumentException("maxSyncPathLength must be positive");
        }
        if (shutdownTimeout.isNegative()) {
            throw new IllegalArgumentException("shutdownTimeout must not be negative");
        }
    }

    public static EmulatorConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AddressFamily addressFamily = AddressFamily.IPV4;
        private int port = 0;
        private int protocolVersion = AdbWireFormat.DEFAULT_PROTOCOL_VERSION;
        private int maxPayload = AdbWireFormat.DEFAULT_MAX_PAYLOAD;
        private String banner = DEFAULT_BANNER;
        private String pullContent = DEFAULT_PULL_CONTENT;
        private int maxInboundPayload = DEFAULT_MAX_INBOUND_PAYLOAD;
        private int maxSyncPathLength = DEFAULT_MAX_SYNC_PATH_LENGTH;
        private Duration shutdownTimeout = Duration.ofSeconds(5);

        public Builder withAddressFamily(AddressFamily addressFamily) {
            this.addressFamily = addressFamily;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withProtocolVersion(int protocolVersion) {
            this.protocolVersion = protocolVersion;
            return this;
        }

        public Builder withMaxPayload(int maxPayload) {
            this.maxPayload = maxPayload;
            return this;
        }

        public Builder withBanner(String banner) {
            this.banner = banner;
            return this;
        }

        public Builder withPullContent(String pullContent) {
            this.pullContent = pullContent;
            return this;
        }

        public Builder withMaxInboundPayload(int maxInboundPayload) {
            this.maxInboundPayload = maxInboundPayload;
            return this;
        }

        public Builder withMaxSyncPathLength(int maxSyncPathLength) {
            this.maxSyncPathLength = maxSyncPathLength;
            return this;
        }

        public Builder withShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public EmulatorConfig build() {
            return new EmulatorConfig(addressFamily, port, protocolVersion, maxPayload, banner,
                pullContent, maxInboundPayload, maxSyncPathLength, shutdownTimeout);
        }
    }
}
