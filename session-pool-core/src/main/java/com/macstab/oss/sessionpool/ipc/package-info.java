/* (C)2026 Christian Schnapka / Macstab GmbH */

/**
 * Socket transport between the processes of one pool group.
 *
 * <p>{@link com.macstab.oss.sessionpool.ipc.PoolClient} is the public entry point; it embeds a
 * {@link com.macstab.oss.sessionpool.ipc.PoolServer} while its process leads. Frames are
 * newline-delimited JSON, see {@link com.macstab.oss.sessionpool.ipc.protocol}.
 */
package com.macstab.oss.sessionpool.ipc;
