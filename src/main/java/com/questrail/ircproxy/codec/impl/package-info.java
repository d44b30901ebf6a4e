/**
 * Concrete codecs for the two IRC wire formats.
 *
 * <ul>
 *   <li>{@link com.questrail.ircproxy.codec.impl.LineCodec} and
 *       {@link com.questrail.ircproxy.codec.impl.LineStreamDecoder}: RFC 1459 lines</li>
 *   <li>{@link com.questrail.ircproxy.codec.impl.JsonCodec} and
 *       {@link com.questrail.ircproxy.codec.impl.JsonStreamDecoder}: concatenated
 *       JSON objects, parsed with Jackson's non-blocking parser</li>
 * </ul>
 *
 * <p>All classes here are pure computation over bytes already received. They
 * never block and never touch a socket.</p>
 */
package com.questrail.ircproxy.codec.impl;
