package chatfeed.spring.boot;

import chatfeed.bus.DefaultEventBus;
import chatfeed.bus.EventBus;
import chatfeed.jdbc.DataSourceConnectionProvider;
import chatfeed.jdbc.PostgresChangeChannel;
import chatfeed.jdbc.PostgresTriggerInstaller;
import chatfeed.listener.MessageChangeListener;
import chatfeed.spi.ChangeChannel;
import chatfeed.spi.ConnectionProvider;
import chatfeed.spi.MetricsExporter;
import chatfeed.spi.TriggerInstaller;
import chatfeed.supervisor.FixedBackoffReconnectPolicy;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the message change feed.
 *
 * <p>Wires a {@link MessageChangeListener} from a {@link DataSource} and
 * {@link ChatfeedProperties}, registers {@link MessageChangeHandler} beans on it, and
 * connects it when the context starts (unless {@code chatfeed.auto-connect=false}).
 *
 * @see ChatfeedProperties
 * @see ChatfeedMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MessageChangeListener.class)
@ConditionalOnBean(DataSource.class)
@ConditionalOnProperty(prefix = "chatfeed", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(ChatfeedProperties.class)
public class ChatfeedAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ChangeChannel.class)
  public PostgresChangeChannel changeChannel() {
    return new PostgresChangeChannel();
  }

  @Bean
  @ConditionalOnMissingBean(TriggerInstaller.class)
  public TriggerInstaller triggerInstaller(ChatfeedProperties props) {
    if (!props.isInstallTriggers()) {
      return TriggerInstaller.NONE;
    }
    return new PostgresTriggerInstaller(props.getTableName(), props.getFunctionName(),
        props.getTriggerName(), props.getChannel());
  }

  @Bean
  @ConditionalOnMissingBean(EventBus.class)
  public DefaultEventBus eventBus(ObjectProvider<MetricsExporter> metricsProvider) {
    return new DefaultEventBus(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP));
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public MessageChangeListener messageChangeListener(ChatfeedProperties props,
      ConnectionProvider connectionProvider,
      ChangeChannel changeChannel,
      TriggerInstaller triggerInstaller,
      EventBus eventBus,
      ObjectProvider<MetricsExporter> metricsProvider) {

    var builder = MessageChangeListener.builder()
        .connectionProvider(connectionProvider)
        .changeChannel(changeChannel)
        .triggerInstaller(triggerInstaller)
        .eventBus(eventBus)
        .channel(props.getChannel())
        .pollTimeoutMs(props.getPollTimeoutMs())
        .reconnectPolicy(new FixedBackoffReconnectPolicy(
            props.getReconnect().getInitialDelayMs(), props.getReconnect().getRetryDelayMs()));
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public MessageChangeHandlerRegistrar messageChangeHandlerRegistrar(
      ListableBeanFactory beanFactory, MessageChangeListener listener) {
    return new MessageChangeHandlerRegistrar(beanFactory, listener);
  }

  @Bean
  @ConditionalOnMissingBean
  public ChatfeedLifecycle chatfeedLifecycle(MessageChangeListener listener, ChatfeedProperties props) {
    return new ChatfeedLifecycle(listener, props.isAutoConnect(), props.isFailFast());
  }
}
