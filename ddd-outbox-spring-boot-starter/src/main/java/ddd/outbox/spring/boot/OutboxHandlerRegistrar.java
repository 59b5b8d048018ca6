package ddd.outbox.spring.boot;

import ddd.outbox.factory.OutboxMessageFactory;
import ddd.outbox.handler.DefaultHandlerRegistry;
import ddd.outbox.handler.OutboxMessageHandler;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.lang.annotation.Annotation;
import java.util.Map;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * Registers beans annotated with {@link OutboxHandler} or {@link IntegrationEventHandler}
 * in the {@link DefaultHandlerRegistry}.
 *
 * <p>Runs after all singletons are initialized, before the outbox is started.
 */
public class OutboxHandlerRegistrar implements SmartInitializingSingleton {
  private static final Logger logger = Logger.getLogger(OutboxHandlerRegistrar.class.getName());

  private final ListableBeanFactory beanFactory;
  private final DefaultHandlerRegistry registry;

  public OutboxHandlerRegistrar(ListableBeanFactory beanFactory, DefaultHandlerRegistry registry) {
    this.beanFactory = beanFactory;
    this.registry = registry;
  }

  @Override
  public void afterSingletonsInstantiated() {
    registerAll(OutboxHandler.class, OutboxHandler::value);
    registerAll(IntegrationEventHandler.class,
        annotation -> OutboxMessageFactory.integrationEventType(annotation.value()));
  }

  private <A extends Annotation> void registerAll(Class<A> annotationType,
      Function<A, String> messageTypeOf) {
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(annotationType);
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      Object bean = entry.getValue();
      String annotationName = "@" + annotationType.getSimpleName();

      if (!(bean instanceof OutboxMessageHandler<?> handler)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with " + annotationName + " must implement OutboxMessageHandler, "
                + "but " + bean.getClass().getName() + " does not");
      }

      // proxies may hide the annotation
      A annotation = AnnotationUtils.findAnnotation(bean.getClass(), annotationType);
      if (annotation == null) {
        annotation = beanFactory.findAnnotationOnBean(beanName, annotationType);
      }
      if (annotation == null) {
        throw new BeanCreationException(beanName,
            "Could not find " + annotationName + " annotation on " + bean.getClass().getName());
      }

      final String messageType;
      try {
        messageType = messageTypeOf.apply(annotation);
      } catch (IllegalArgumentException e) {
        throw new BeanCreationException(beanName,
            "Invalid " + annotationName + " on " + bean.getClass().getName(), e);
      }
      if (messageType.isEmpty()) {
        throw new BeanCreationException(beanName,
            annotationName + " on " + bean.getClass().getName() + " must name a message type");
      }
      registry.register(messageType, handler);
      logger.fine(() -> "Registered bean '" + beanName + "' for message type " + messageType);
    }
  }
}
