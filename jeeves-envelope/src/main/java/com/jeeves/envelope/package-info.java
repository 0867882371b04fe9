/**
 * Per-run state of a pipeline.
 * <ul>
 *   <li>{@link com.jeeves.envelope.Envelope}: outputs, bounds, stage sets, goals, interrupt and audit state</li>
 *   <li>{@link com.jeeves.envelope.FlowInterrupt} / {@link com.jeeves.envelope.InterruptResponse}: single-slot pause request and its answer</li>
 *   <li>{@link com.jeeves.envelope.ProcessingRecord}: one agent invocation in the audit history</li>
 *   <li>{@link com.jeeves.envelope.EnvelopeStateCodec}: JSON form of the state dict</li>
 *   <li>{@link com.jeeves.envelope.DeepCopy}: recursive copy of JSON-like values</li>
 * </ul>
 */
package com.jeeves.envelope;
