/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Shared session pool core (NO Spring dependencies).
 *
 * <h2>Purpose</h2>
 *
 * <p>Keeps a small, fixed set of long-lived backend sessions (subprocesses speaking stream-json)
 * warm and reuses them across requests, so an editor gets completions without paying process
 * start-up and prompt priming on every keystroke. Several editor processes of one user share a
 * single pool: one of them leads and owns the sessions, the others talk to it over a Unix domain
 * socket.
 *
 * <h2>Layers</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────┐
 * │ ipc.PoolClient      election, failover, local fast path │
 * ├─────────────────────────────────────────────────────────┤
 * │ ipc.PoolServer      socket listener, request dispatch   │
 * ├─────────────────────────────────────────────────────────┤
 * │ pool.CompletionPool / pool.CommandPool                  │
 * ├─────────────────────────────────────────────────────────┤
 * │ slot.SlotPool       lifecycle, latest-wins, recycling   │
 * ├─────────────────────────────────────────────────────────┤
 * │ channel.SessionChannel   one backend subprocess         │
 * └─────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Slot Lifecycle</h2>
 *
 * <pre>
 * DEAD → INITIALIZING → AVAILABLE ⇄ BUSY
 *   ↑                                 │
 *   └──── recycle (reuse limit, stream failure, timeout)
 * </pre>
 *
 * <p>A slot serves a bounded number of requests before it is recycled, so conversation history in
 * the backend session never grows without bound. Every recycle bumps the slot generation; events
 * from an older generation are dropped.
 *
 * <h2>Request Admission</h2>
 *
 * <p>Only the most recent caller is favored. When no slot is free the request becomes the single
 * pending waiter and displaces any earlier waiter, which resolves empty. For completions typed
 * keystroke by keystroke, a stale request is worthless anyway.
 *
 * <h2>Failure Isolation</h2>
 *
 * <ul>
 *   <li>A failed warm-up kills and re-initializes every slot once; a second failed round disables
 *       the pool until the next restart
 *   <li>Five recycles of one slot within five seconds retire it
 *   <li>All slots retired means the pool is degraded; listeners are told once per episode
 *   <li>Callers never see exceptions from {@code getCompletion} or {@code sendCommand}, only empty
 *       results
 * </ul>
 *
 * <h2>Threading</h2>
 *
 * <p>Each pool runs a single-threaded event loop. Slot state is only touched on that loop, so the
 * engine needs no locks. Public methods hop onto the loop and return {@code CompletableFuture}s.
 *
 * @since 1.0.0
 * @author Christian Schnapka - Macstab GmbH
 */
package com.macstab.oss.sessionpool;
