/**
 * WebSocket Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete WebSocket implementation (Netty, a simulator, or a test
 * double) and the client's connection state machine.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the resolve, connect, handshake, framing and close work. These
 * ports keep Netty types out of the state machine, which only ever sees:
 * <ul>
 *   <li>Text payloads as {@code String}</li>
 *   <li>Outcomes as values ({@link com.questrail.wsclient.transport.ConnectResult},
 *       {@link com.questrail.wsclient.transport.ReadOutcome},
 *       {@link com.questrail.wsclient.transport.WriteResult})</li>
 * </ul>
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Report expected failures as values, never by throwing</li>
 *   <li>Not reconnect, retry, queue or schedule anything</li>
 * </ul>
 *
 * <p>All recovery behavior lives in the connection state controller.</p>
 */
package com.questrail.wsclient.transport;
