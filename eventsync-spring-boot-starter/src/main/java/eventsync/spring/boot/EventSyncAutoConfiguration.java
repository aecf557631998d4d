package eventsync.spring.boot;

import eventsync.EventEmitter;
import eventsync.EventSync;
import eventsync.jdbc.TableNames;
import eventsync.jdbc.log.AbstractJdbcEventLog;
import eventsync.jdbc.log.JdbcEventLogs;
import eventsync.jdbc.presence.JdbcPresenceStore;
import eventsync.jdbc.purge.JdbcEventPurgers;
import eventsync.jdbc.sequence.JdbcSequenceService;
import eventsync.spi.ClusterRelay;
import eventsync.spi.ConnectionProvider;
import eventsync.spi.MetricsExporter;
import eventsync.spi.PresenceStore;
import eventsync.spi.SequenceService;
import eventsync.spi.TxContext;
import eventsync.spring.SpringTxContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for event synchronization.
 *
 * <p>Wires up an {@link EventSync} composite from a {@link DataSource} and
 * {@link EventSyncProperties}, detects the database dialect for the event log and purger,
 * and starts the background schedules. Multi-node mode needs a {@link ClusterRelay} bean and
 * keeps presence in the shared database table unless a {@link PresenceStore} bean is present.
 *
 * @see EventSyncProperties
 * @see EventSyncMicrometerAutoConfiguration
 * @see EventSyncWebSocketAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventSync.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventSyncProperties.class)
public class EventSyncAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcEventLog eventLog(DataSource dataSource, EventSyncProperties props) {
    AbstractJdbcEventLog detected = JdbcEventLogs.detect(dataSource);
    if (!TableNames.DEFAULT_EVENT_TABLE.equals(props.getTableName())) {
      return detected.withTableName(props.getTableName());
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public ConnectionProvider connectionProvider(DataSource dataSource) {
    return dataSource::getConnection;
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext() {
    return new SpringTxContext();
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  public EventSync eventSync(EventSyncProperties props,
      ConnectionProvider connectionProvider,
      TxContext txContext,
      AbstractJdbcEventLog eventLog,
      ObjectProvider<SequenceService> sequenceProvider,
      ObjectProvider<ClusterRelay> relayProvider,
      ObjectProvider<PresenceStore> presenceStoreProvider,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    PresenceStore presenceStore = presenceStoreProvider.getIfAvailable();
    SequenceService sequenceService = sequenceProvider.getIfAvailable();

    return switch (props.getMode()) {
      case SINGLE_NODE -> {
        var builder = EventSync.singleNode();
        configure(builder, props, connectionProvider, txContext, eventLog, metrics, presenceStore);
        if (sequenceService != null) {
          builder.sequenceService(sequenceService);
        } else if (props.isSharedSequence()) {
          builder.sequenceService(jdbcSequence(props, connectionProvider, eventLog));
        }
        yield builder.build();
      }
      case MULTI_NODE -> {
        ClusterRelay relay = relayProvider.getIfAvailable();
        if (relay == null) {
          throw new IllegalStateException(
              "eventsync.mode=MULTI_NODE requires a ClusterRelay bean");
        }
        var builder = EventSync.multiNode();
        configure(builder, props, connectionProvider, txContext, eventLog, metrics,
            presenceStore != null ? presenceStore
                : new JdbcPresenceStore(connectionProvider, props.getPresence().getTableName()));
        builder.sequenceService(sequenceService != null
            ? sequenceService : jdbcSequence(props, connectionProvider, eventLog));
        builder.clusterRelay(relay);
        yield builder.build();
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public EventEmitter eventEmitter(EventSync eventSync) {
    return eventSync.emitter();
  }

  private static void configure(EventSync.AbstractBuilder<?> builder, EventSyncProperties props,
      ConnectionProvider connectionProvider, TxContext txContext, AbstractJdbcEventLog eventLog,
      MetricsExporter metrics, PresenceStore presenceStore) {
    builder.connectionProvider(connectionProvider)
        .eventLog(eventLog)
        .txContext(txContext)
        .retention(props.getRetention())
        .pageSize(props.getCatchUp().getPageSize())
        .maxQueuedFrames(props.getConnection().getMaxQueuedFrames())
        .maxMalformedMessages(props.getConnection().getMaxMalformedMessages())
        .pingInterval(props.getKeepAlive().getPingInterval())
        .idleTimeout(props.getKeepAlive().getIdleTimeout())
        .presenceTtl(props.getPresence().getTtl());
    if (props.getPurge().isEnabled()) {
      builder.purger(JdbcEventPurgers.forLog(eventLog))
          .purgeBatchSize(props.getPurge().getBatchSize())
          .purgeIntervalSeconds(props.getPurge().getIntervalSeconds());
    }
    if (metrics != null) {
      builder.metrics(metrics);
    }
    if (presenceStore != null) {
      builder.presenceStore(presenceStore);
    }
  }

  private static SequenceService jdbcSequence(EventSyncProperties props,
      ConnectionProvider connectionProvider, AbstractJdbcEventLog eventLog) {
    return JdbcSequenceService.forDialect(eventLog.name(), connectionProvider,
        props.getSequenceTableName(), eventLog.tableName());
  }
}
