/* (C)2026 Christian Schnapka / Macstab GmbH */

/** Lockfile-based leader election between the processes sharing one pool. */
package com.macstab.oss.sessionpool.election;
