/**
 * Stream Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a test double) and
 * the relay core.
 *
 * <h2>Why these ports exist</h2>
 * The relay runs on Netty's event loop model in production
 * <strong>without</strong> Netty types leaking into codecs or the
 * format-switch state machine. Everything above the transport adapter sees
 * only:
 * <ul>
 *   <li>Raw received chunks as {@code byte[]}</li>
 *   <li>Outbound bytes as {@code byte[]}</li>
 *   <li>Lifecycle notifications (writability, disconnect)</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only (no IRC interpretation)</li>
 *   <li>Not frame or decode messages</li>
 *   <li>Serialize callbacks per endpoint</li>
 * </ul>
 */
package com.questrail.ircproxy.transport;
