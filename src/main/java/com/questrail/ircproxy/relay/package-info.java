/**
 * Relay core: per-leg format-switch state machine and the pair that forwards
 * messages between a client and a server.
 *
 * <pre>
 *   client bytes → ConnectionChannel(DOWNSTREAM) → IrcMessage
 *                      → RelayPair → ConnectionChannel(UPSTREAM).send → server bytes
 * </pre>
 *
 * <p>Both legs of a pair are driven from one thread. Nothing in this package
 * blocks or locks.</p>
 */
package com.questrail.ircproxy.relay;
