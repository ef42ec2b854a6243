/**
 * Durable subscription checkpoints, in memory or as marker events in a {@code checkpoint_{id}}
 * stream.
 */
package com.strata.subscription.checkpoint;
