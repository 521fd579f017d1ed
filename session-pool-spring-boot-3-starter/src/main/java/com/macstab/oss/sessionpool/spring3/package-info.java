/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Spring Boot 3 auto-configuration for the shared session pool.
 *
 * <p>Adding the starter gives every application process a {@link
 * com.macstab.oss.sessionpool.ipc.PoolClient} bean. The first process to start becomes the server
 * and owns the backend sessions; later processes connect to it over a Unix domain socket in the
 * configured state directory. Add {@code session-pool-metrics} for Micrometer meters.
 *
 * <pre>{@code
 * session-pool:
 *   model: haiku
 *   completion-pool-size: 2
 * }</pre>
 *
 * @since 1.0.0
 * @see com.macstab.oss.sessionpool.spring3.SessionPoolProperties
 */
package com.macstab.oss.sessionpool.spring3;
