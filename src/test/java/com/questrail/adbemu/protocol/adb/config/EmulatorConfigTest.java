package com.questrail.adbemu.protocol.adb.config;

import com.questrail.adbemu.protocol.adb.codec.impl.AdbWireFormat;

import org.junit.jupiter.api.Test;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

final class EmulatorConfigTest
{
    @Test
    void defaultsMatchTheDaemonGreeting()
    {
        EmulatorConfig config = EmulatorConfig.defaults();

        assertEquals(AddressFamily.IPV4, config.addressFamily());
        assertEquals(0, config.port());
        assertEquals(AdbWireFormat.DEFAULT_PROTOCOL_VERSION, config.protocolVersion());
        assertEquals(4096, config.maxPayload());
        assertEquals("device::", config.banner());
        assertEquals("hello from fake adbd", config.pullContent());
        assertEquals(1024 * 1024, config.maxInboundPayload());
        assertEquals(1024, config.maxSyncPathLength());
    }

    @Test
    void builderOverridesIndividualFields()
    {
        EmulatorConfig config = EmulatorConfig.builder()
            .withAddressFamily(AddressFamily.IPV6)
            .withPort(15037)
            .withPullContent("x")
            .withShutdownTimeout(Duration.ofMillis(250))
            .build();

        assertEquals(AddressFamily.IPV6, config.addressFamily());
        assertEquals(15037, config.port());
        assertEquals("x", config.pullContent());
        assertEquals(Duration.ofMillis(250), config.shutdownTimeout());
        assertEquals("device::", config.banner());
    }

    @Test
    void invalidValuesAreRejected()
    {
        assertThrows(IllegalArgumentException.class, () -> EmulatorConfig.builder().withPort(-1).build());
        assertThrows(IllegalArgumentException.class, () -> EmulatorConfig.builder().withPort(65536).build());
        assertThrows(IllegalArgumentException.class, () -> EmulatorConfig.builder().withMaxInboundPayload(0).build());
        assertThrows(IllegalArgumentException.class, () -> EmulatorConfig.builder().withMaxSyncPathLength(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> EmulatorConfig.builder().withShutdownTimeout(Duration.ofSeconds(-1)).build());
        assertThrows(NullPointerException.class, () -> EmulatorConfig.builder().withBanner(null).build());
    }

    @Test
    void addressFamiliesResolveToLoopback()
    {
        assertInstanceOf(Inet4Address.class, AddressFamily.IPV4.loopbackAddress());
        assertInstanceOf(Inet6Address.class, AddressFamily.IPV6.loopbackAddress());
        assertTrue(AddressFamily.IPV4.loopbackAddress().isLoopbackAddress());
        assertTrue(AddressFamily.IPV6.loopbackAddress().isLoopbackAddress());
        assertEquals("127.0.0.1", AddressFamily.IPV4.loopbackAddress().getHostAddress());
    }
}
