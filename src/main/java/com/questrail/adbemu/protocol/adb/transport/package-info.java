/**
 * Stream Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double) and
 * the emulator's connection state machine.
 *
 * <h2>Why these ports exist</h2>
 * The emulator runs on a Netty event loop <strong>without</strong> allowing
 * Netty types to leak into the protocol layer. Everything above the transport
 * adapter sees only:
 * <ul>
 *   <li>raw byte chunks as {@code byte[]}</li>
 *   <li>connection identifiers as plain strings</li>
 *   <li>transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>perform transport I/O only (no protocol interpretation)</li>
 *   <li>deliver every callback of one connection on a single thread</li>
 *   <li>deliver inbound bytes in exactly the chunk size requested</li>
 * </ul>
 */
package com.questrail.adbemu.protocol.adb.transport;
