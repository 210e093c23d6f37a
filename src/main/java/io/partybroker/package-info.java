/**
 * Party broker source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.partybroker.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.partybroker.cli.BrokerCommand} maps commands to broker APIs.</li>
 *   <li>{@code io.partybroker.executor.QueryRunner} drives a query from preparation to engine execution.
 *   Queries are submitted by an embedding front end that builds a {@code BrokerApp} with its own
 *   {@code Compiler} and {@code ExecutionEngine}, then calls {@code createSession} and
 *   {@code newQueryRunner(session).run(tables)}. The {@code serve} command takes no queries.</li>
 *   <li>{@code io.partybroker.storage.MetaStore} and {@code io.partybroker.storage.SessionStore} are the persistence layer.</li>
 * </ul>
 */
package io.partybroker;
