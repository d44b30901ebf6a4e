/**
 * IRC Codec Ports
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> between raw
 * stream bytes and {@link com.questrail.ircproxy.model.IrcMessage}. Two
 * serializations exist (see {@link com.questrail.ircproxy.codec.WireFormat}):</p>
 *
 * <ul>
 *   <li>the RFC 1459 line format,
 *       {@code [@tags ][:sender ]COMMAND[ params][ :trailing]\r\n}</li>
 *   <li>the JSON format,
 *       {@code {"tags":{},"source":null,"verb":"privmsg","params":[]}}</li>
 * </ul>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   byte[] chunk
 *        → IrcStreamDecoder      (framing + parsing, incremental)
 *            → IrcMessage
 *                → RelayPair     (forwarding)
 *                    → IrcMessageEncoder
 *                        → byte[] for the peer transport
 * </pre>
 *
 * <h2>Important Boundaries</h2>
 * <ul>
 *   <li>Codecs never touch sockets and never see transport framework types.</li>
 *   <li>Codecs do not interpret message meaning. STARTJSON and QUIT are
 *       recognised one layer up, in the relay.</li>
 *   <li>Failures surface as {@link com.questrail.ircproxy.codec.IrcDecodeException}
 *       or {@link com.questrail.ircproxy.codec.IrcEncodeException}; the caller
 *       decides what happens to the connection.</li>
 * </ul>
 */
package com.questrail.ircproxy.codec;
