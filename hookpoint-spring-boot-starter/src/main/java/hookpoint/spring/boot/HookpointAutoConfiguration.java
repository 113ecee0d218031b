package hookpoint.spring.boot;

import hookpoint.OwnerResolver;
import hookpoint.dispatch.HookDispatcher;
import hookpoint.dispatch.HookInterceptor;
import hookpoint.registry.DefaultHookRegistry;
import hookpoint.registry.HookRegistry;
import hookpoint.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for hookpoint.
 *
 * <p>Provides one {@link HookRegistry} and one {@link HookDispatcher} per application
 * context, and registers every {@link HookComponent} bean into that registry. Any
 * {@link HookInterceptor} beans are applied in their {@code @Order}.
 *
 * @see HookpointProperties
 * @see HookpointMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(HookDispatcher.class)
@EnableConfigurationProperties(HookpointProperties.class)
public class HookpointAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(HookRegistry.class)
  public DefaultHookRegistry hookRegistry() {
    return new DefaultHookRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public OwnerResolver ownerResolver() {
    return OwnerResolver.PACKAGE;
  }

  @Bean
  @ConditionalOnMissingBean
  @ConditionalOnProperty(prefix = "hookpoint.registrar", name = "enabled", matchIfMissing = true)
  public HookComponentRegistrar hookComponentRegistrar(
      ListableBeanFactory beanFactory,
      HookRegistry hookRegistry,
      OwnerResolver ownerResolver) {
    return new HookComponentRegistrar(beanFactory, hookRegistry, ownerResolver);
  }

  @Bean
  @ConditionalOnMissingBean
  public HookDispatcher hookDispatcher(HookRegistry hookRegistry,
      OwnerResolver ownerResolver,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<HookInterceptor> interceptorProvider) {

    var builder = HookDispatcher.builder()
        .registry(hookRegistry)
        .ownerResolver(ownerResolver)
        .interceptors(interceptorProvider.orderedStream().toList());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }
}
