package upbus.spring.boot;

import upbus.ConfigurationException;
import upbus.LocalTransport;
import upbus.StaticUriProvider;
import upbus.UTransport;
import upbus.UriProvider;
import upbus.communication.Notifier;
import upbus.communication.Publisher;
import upbus.communication.SimpleNotifier;
import upbus.communication.SimplePublisher;
import upbus.network.NetworkTransport;
import upbus.network.PubSubSessionFactory;
import upbus.network.udp.UdpMulticastSession;
import upbus.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for upbus.
 *
 * <p>Wires a {@link UTransport} selected by {@code upbus.transport}, the application's
 * {@link UriProvider}, a {@link Publisher} and a {@link Notifier}, and registers
 * {@link TopicListener}-annotated beans once the context is up.
 *
 * <p>For {@code upbus.transport=NETWORK} a {@link PubSubSessionFactory} bean, when present,
 * replaces the default UDP multicast session.
 *
 * @see UpbusProperties
 * @see UpbusMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(UTransport.class)
@EnableConfigurationProperties(UpbusProperties.class)
public class UpbusAutoConfiguration {

  private static final long MAX_ENTITY_ID = 0xFFFF_FFFFL;

  @Bean
  @ConditionalOnMissingBean
  public UriProvider uriProvider(UpbusProperties props) {
    long entityId = props.getEntityId();
    if (entityId < 0 || entityId > MAX_ENTITY_ID) {
      throw new ConfigurationException("upbus.entity-id must be in 0.." + MAX_ENTITY_ID + ", was " + entityId);
    }
    try {
      return new StaticUriProvider(props.getAuthority(), (int) entityId, props.getVersion());
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid upbus identity: " + e.getMessage(), e);
    }
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public UTransport transport(UpbusProperties props,
      UriProvider uriProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<PubSubSessionFactory> sessionFactoryProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable();

    return switch (props.getTransport()) {
      case LOCAL -> {
        var builder = LocalTransport.builder();
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
      case NETWORK -> {
        var network = props.getNetwork();
        PubSubSessionFactory sessionFactory = sessionFactoryProvider.getIfAvailable(
            () -> UdpMulticastSession.factory(network.getGroup(), network.getPort(), network.getTtl()));
        var builder = NetworkTransport.builder(uriProvider.getAuthority())
            .sessionFactory(sessionFactory);
        if (metrics != null) {
          builder.metrics(metrics);
        }
        yield builder.build();
      }
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public Publisher publisher(UTransport transport, UriProvider uriProvider) {
    return new SimplePublisher(transport, uriProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public Notifier notifier(UTransport transport, UriProvider uriProvider) {
    return new SimpleNotifier(transport, uriProvider);
  }

  @Bean
  @ConditionalOnMissingBean
  public TopicListenerRegistrar topicListenerRegistrar(ListableBeanFactory beanFactory,
      UTransport transport, UriProvider uriProvider) {
    return new TopicListenerRegistrar(beanFactory, transport, uriProvider);
  }
}
