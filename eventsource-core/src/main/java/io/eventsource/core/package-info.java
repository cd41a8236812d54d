/**
 * Protocol-centric core for Server-Sent Events.
 *
 * <p>This module is deliberately transport-neutral. It contains only:
 * <ul>
 *   <li>Protocol constants and the error taxonomy</li>
 *   <li>A growable, capped line reader for raw response bodies</li>
 *   <li>The field parser and the per-message assembler</li>
 * </ul>
 *
 * <p>HTTP bindings and the reconnecting client live in other modules.
 */
package io.eventsource.core;
