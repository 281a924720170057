package signals.spring.boot;

import signals.Signal;
import signals.SignalHub;
import signals.dispatch.CompositeDispatchObserver;
import signals.dispatch.DispatchObserver;
import signals.dispatch.LoggingDispatchObserver;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.util.ClassUtils;

import java.util.List;

/**
 * Auto-configuration for the signal hub.
 *
 * <p>Creates a {@link SignalHub} from {@link SignalsProperties}, installs any
 * {@link DispatchObserver} beans on it and registers {@link SignalListener} beans.
 * The hub is cleared when the context closes.
 *
 * @see SignalsProperties
 */
@AutoConfiguration
@ConditionalOnClass(SignalHub.class)
@EnableConfigurationProperties(SignalsProperties.class)
public class SignalsAutoConfiguration {

  @Bean(destroyMethod = "clear")
  @ConditionalOnMissingBean
  public SignalHub signalHub(SignalsProperties props,
      ObjectProvider<DispatchObserver> observerProvider) {
    SignalHub hub = SignalHub.builder()
        .redispatchPolicy(props.getRedispatchPolicy())
        .dispatchObserver(resolveObserver(props, observerProvider.orderedStream().toList()))
        .build();

    for (String name : props.getPreload()) {
      hub.resolve(loadSignalClass(name));
    }
    return hub;
  }

  @Bean
  @ConditionalOnMissingBean
  public SignalListenerRegistrar signalListenerRegistrar(ListableBeanFactory beanFactory,
      SignalHub signalHub) {
    return new SignalListenerRegistrar(beanFactory, signalHub);
  }

  private static DispatchObserver resolveObserver(SignalsProperties props,
      List<DispatchObserver> observers) {
    if (observers.size() == 1) {
      return observers.get(0);
    }
    if (observers.size() > 1) {
      return new CompositeDispatchObserver(observers);
    }
    return props.isLogDispatches() ? new LoggingDispatchObserver() : null;
  }

  private static Class<?> loadSignalClass(String name) {
    try {
      Class<?> type = ClassUtils.forName(name.trim(), ClassUtils.getDefaultClassLoader());
      if (!Signal.class.isAssignableFrom(type)) {
        throw new IllegalStateException(
            "signals.preload entry " + name + " does not implement " + Signal.class.getName());
      }
      return type;
    } catch (ClassNotFoundException | LinkageError e) {
      throw new IllegalStateException("signals.preload entry " + name + " could not be loaded", e);
    }
  }
}
