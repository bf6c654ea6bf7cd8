/**
 * Coordinator Transport Ports
 * =============================================================================
 *
 * These interfaces define the framework-agnostic boundary between a concrete
 * stream server (Netty TCP, or a test double) and the validation coordinator.
 *
 * <p>Everything above the transport sees only:</p>
 * <ul>
 *   <li>whole records as {@code byte[]}</li>
 *   <li>connections as opaque {@link com.questrail.crossval.transport.ConnectionId}s</li>
 *   <li>connection lifecycle notifications</li>
 * </ul>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O and record framing only</li>
 *   <li>Not decode records into messages</li>
 *   <li>Deliver callbacks serially on a single thread</li>
 * </ul>
 *
 * <p>Registration, barrier state and fail-fast policy live in the coordinator.</p>
 */
package com.questrail.crossval.transport;
