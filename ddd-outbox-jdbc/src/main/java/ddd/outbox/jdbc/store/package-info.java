/**
 * Dialect-specific outbox stores and their {@link java.util.ServiceLoader} registry.
 */
package ddd.outbox.jdbc.store;
