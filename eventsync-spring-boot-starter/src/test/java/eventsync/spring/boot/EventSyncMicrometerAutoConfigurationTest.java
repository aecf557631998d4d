package eventsync.spring.boot;

import eventsync.micrometer.MicrometerMetricsExporter;
import eventsync.spi.MetricsExporter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class EventSyncMicrometerAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(EventSyncMicrometerAutoConfiguration.class))
      .withUserConfiguration(MeterRegistryConfig.class);

  @Test
  void createsMicrometerExporterByDefault() {
    runner.run(ctx -> {
      assertTrue(ctx.containsBean("micrometerMetricsExporter"));
      assertInstanceOf(MicrometerMetricsExporter.class, ctx.getBean(MetricsExporter.class));
    });
  }

  @Test
  void respectsCustomNamePrefix() {
    runner.withPropertyValues("eventsync.metrics.name-prefix=crm.sync").run(ctx -> {
      ctx.getBean(MetricsExporter.class).incrementEmitted();
      var registry = ctx.getBean(MeterRegistry.class);
      assertEquals(1.0, registry.find("crm.sync.events.emitted").counter().count());
    });
  }

  @Test
  void disabledWhenPropertyFalse() {
    runner.withPropertyValues("eventsync.metrics.enabled=false").run(ctx -> {
      assertFalse(ctx.containsBean("micrometerMetricsExporter"));
    });
  }

  @Test
  void notCreatedWithoutMeterRegistry() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(EventSyncMicrometerAutoConfiguration.class))
        .run(ctx -> {
          assertFalse(ctx.containsBean("micrometerMetricsExporter"));
        });
  }

  @Test
  void backsOffWhenCustomMetricsExporterPresent() {
    runner.withUserConfiguration(CustomExporterConfig.class).run(ctx -> {
      assertFalse(ctx.getBean(MetricsExporter.class) instanceof MicrometerMetricsExporter);
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
