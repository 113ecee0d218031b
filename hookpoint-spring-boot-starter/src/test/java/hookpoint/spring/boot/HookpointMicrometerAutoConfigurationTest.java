package hookpoint.spring.boot;

import hookpoint.dispatch.HookDispatcher;
import hookpoint.micrometer.MicrometerMetricsExporter;
import hookpoint.registry.HookRegistry;
import hookpoint.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HookpointMicrometerAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(
                    HookpointMicrometerAutoConfiguration.class,
                    HookpointAutoConfiguration.class))
            .withUserConfiguration(MeterRegistryConfig.class);

    @Test
    void createsMicrometerExporterByDefault() {
        runner.run(ctx -> {
            assertTrue(ctx.containsBean("micrometerMetricsExporter"));
            assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
        });
    }

    @Test
    void dispatcherReportsToMeterRegistry() {
        runner.run(ctx -> {
            ctx.getBean(HookRegistry.class).register("h", c -> 1, "app");
            ctx.getBean(HookDispatcher.class).invoke("h");

            var registry = ctx.getBean(MeterRegistry.class);
            assertEquals(1.0, registry.find("hookpoint.invoke").counter().count());
            assertEquals(1.0, registry.find("hookpoint.handler.success").counter().count());
        });
    }

    @Test
    void respectsCustomNamePrefix() {
        runner.withPropertyValues("hookpoint.metrics.name-prefix=my.hooks").run(ctx -> {
            var registry = ctx.getBean(MeterRegistry.class);
            assertNotNull(registry.find("my.hooks.invoke").counter());
        });
    }

    @Test
    void disabledWhenPropertyFalse() {
        runner.withPropertyValues("hookpoint.metrics.enabled=false").run(ctx -> {
            assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
    }

    @Test
    void backsOffWhenCustomMetricsExporterPresent() {
        runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
            var exporter = ctx.getBean(MetricsExporter.class);
            assertFalse(exporter instanceof MicrometerMetricsExporter);
        });
    }

    @Test
    void skippedWithoutMeterRegistry() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(
                        HookpointMicrometerAutoConfiguration.class,
                        HookpointAutoConfiguration.class))
                .run(ctx -> {
                    assertFalse(ctx.containsBean("micrometerMetricsExporter"));
                    assertTrue(ctx.containsBean("hookDispatcher"));
                });
    }

    @Configuration
    static class MeterRegistryConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Configuration
    static class CustomExporterConfig {
        @Bean
        MetricsExporter customMetricsExporter() {
            return MetricsExporter.NOOP;
        }
    }
}
