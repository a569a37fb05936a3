package com.acme.amqp.rabbitmq;

import com.acme.amqp.consumer.HandlerScope;
import com.acme.amqp.consumer.ScopeFactory;
import io.micronaut.context.BeanContext;
import io.micronaut.context.exceptions.NoSuchBeanException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves handler dependencies from the Micronaut {@link BeanContext}. Non-singleton beans fetched
 * through a scope are destroyed when the scope closes.
 */
@Slf4j
public class BeanContextScopeFactory implements ScopeFactory {

  private final BeanContext beanContext;

  public BeanContextScopeFactory(BeanContext beanContext) {
    this.beanContext = beanContext;
  }

  @Override
  public HandlerScope openScope() {
    return new Scope();
  }

  private final class Scope implements HandlerScope {

    private final List<Object> created = new ArrayList<>();

    @Override
    public <B> B getBean(Class<B> type) {
      B bean;
      try {
        bean = beanContext.getBean(type);
      } catch (NoSuchBeanException e) {
        throw new IllegalStateException("No bean of type " + type.getName() + " in scope", e);
      }
      if (!beanContext.getBeanDefinition(type).isSingleton()) {
        created.add(bean);
      }
      return bean;
    }

    @Override
    public void close() {
      for (Object bean : created) {
        try {
          beanContext.destroyBean(bean);
        } catch (RuntimeException e) {
          log.warn("Failed to destroy scoped bean {}", bean.getClass().getName(), e);
        }
      }
      created.clear();
    }
  }
}
