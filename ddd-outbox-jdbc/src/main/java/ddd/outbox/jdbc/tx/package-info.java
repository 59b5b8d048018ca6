/**
 * Thread-bound transactions for applications without a transaction framework.
 */
package ddd.outbox.jdbc.tx;
