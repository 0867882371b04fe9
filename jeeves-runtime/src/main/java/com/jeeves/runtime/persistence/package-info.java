/**
 * {@link com.jeeves.protocol.PersistenceAdapter} implementations for run checkpoints.
 */
package com.jeeves.runtime.persistence;
