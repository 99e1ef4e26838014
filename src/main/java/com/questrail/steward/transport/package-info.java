/**
 * Inbound Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic boundary</em> between a
 * concrete network server (Netty HTTP, a gateway client, a test double) and the
 * dispatch core.
 *
 * <h2>Why these ports exist</h2>
 * Netty is used for the production ingress without letting Netty types leak
 * into routing, acknowledgment or admission code. Everything above the
 * endpoint sees only raw request bodies as {@code byte[]}, remote addresses as
 * {@link java.net.SocketAddress}, and endpoint lifecycle notifications.
 *
 * <h2>Architectural constraints (binding)</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not decode event payloads</li>
 *   <li>Not call the router or the response channel</li>
 * </ul>
 */
package com.questrail.steward.transport;
