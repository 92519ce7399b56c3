/**
 * Protection event adapters: structured logging for operators and an in-memory sink for tests.
 */
package ca.gc.cra.brandkit.infrastructure.events;
