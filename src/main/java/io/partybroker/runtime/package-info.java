/**
 * Process wiring.
 *
 * <p>{@link io.partybroker.runtime.BrokerApp} owns the stores, the session registry and the
 * collaborators a {@link io.partybroker.executor.QueryRunner} needs;
 * {@link io.partybroker.gc.GcManager} runs the storage and session GC loops.
 *
 * <p>A broker built from a {@link io.partybroker.config.BrokerConfig} alone answers peer calls and
 * runs GC but cannot run queries. A query front end passes its compiler and engine to the full
 * constructor.
 */
package io.partybroker.runtime;
