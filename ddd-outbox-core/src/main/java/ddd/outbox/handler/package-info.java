/**
 * Message handlers and the type-to-handler registry.
 *
 * @see ddd.outbox.handler.DefaultHandlerRegistry
 */
package ddd.outbox.handler;
