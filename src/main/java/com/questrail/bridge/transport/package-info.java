/**
 * Bridge Transport Ports
 * =============================================================================
 *
 * <p>The framework-agnostic boundary between a concrete WebSocket
 * implementation and the connection manager.</p>
 *
 * <p>Everything above this package sees only:</p>
 * <ul>
 *   <li>Text frames as {@code String}</li>
 *   <li>Lifecycle notifications (up, down, error)</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only; no JSON parsing</li>
 *   <li>Not correlate, queue or retry anything</li>
 *   <li>Not schedule reconnection</li>
 * </ul>
 *
 * <p>Netty types stay inside {@code transport.websocket.netty}.</p>
 */
package com.questrail.bridge.transport;
