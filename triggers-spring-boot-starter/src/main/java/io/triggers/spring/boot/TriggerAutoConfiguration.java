package io.triggers.spring.boot;

import io.triggers.dispatch.DispatchInterceptor;
import io.triggers.registry.DefaultTriggerRegistry;
import io.triggers.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for the trigger framework.
 *
 * <p>Creates a {@link DefaultTriggerRegistry} with the built-in trigger types, the
 * {@link MetricsExporter} and {@link DispatchInterceptor} beans, and every
 * {@link TriggerRegistryCustomizer}; then creates, wires and starts the configured
 * instances. The registry stops its instances when the context closes.
 *
 * @see TriggerProperties
 * @see TriggerMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(DefaultTriggerRegistry.class)
@EnableConfigurationProperties(TriggerProperties.class)
public class TriggerAutoConfiguration {

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public DefaultTriggerRegistry triggerRegistry(
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<DispatchInterceptor> interceptorProvider,
      ObjectProvider<TriggerRegistryCustomizer> customizers) {
    DefaultTriggerRegistry.Builder builder = DefaultTriggerRegistry.builder();
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);

    DefaultTriggerRegistry registry = builder.build();
    DefaultTriggerRegistry.registerBuiltIns(registry);
    customizers.orderedStream().forEach(customizer -> customizer.customize(registry));
    return registry;
  }

  @Bean
  @ConditionalOnMissingBean
  public TriggerHandlerRegistrar triggerHandlerRegistrar(
      ListableBeanFactory beanFactory,
      DefaultTriggerRegistry triggerRegistry,
      TriggerProperties props) {
    return new TriggerHandlerRegistrar(beanFactory, triggerRegistry, props);
  }
}
