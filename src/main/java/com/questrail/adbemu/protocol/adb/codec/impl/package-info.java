/**
 * Default codec implementations.
 *
 * <p>{@link com.questrail.adbemu.protocol.adb.codec.impl.AdbWireFormat} holds
 * the header layout; the encoder and decoder are stateless and safe to share
 * between connections.</p>
 */
package com.questrail.adbemu.protocol.adb.codec.impl;
