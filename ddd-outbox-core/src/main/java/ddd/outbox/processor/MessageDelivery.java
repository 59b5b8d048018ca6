package ddd.outbox.processor;

import ddd.outbox.model.OutboxMessage;

/**
 * One layer of the delivery pipeline. The innermost layer invokes the handler.
 *
 * @see OutboxMiddleware
 */
@FunctionalInterface
public interface MessageDelivery {

  void deliver(OutboxMessage<?> message) throws Exception;
}
