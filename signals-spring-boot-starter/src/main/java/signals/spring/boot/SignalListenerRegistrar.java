package signals.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.ResolvableType;
import org.springframework.core.annotation.AnnotationAwareOrderComparator;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.ClassUtils;
import signals.AbstractSignal;
import signals.Signal;
import signals.SignalConfigurationException;
import signals.SignalHub;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Scans for beans annotated with {@link SignalListener} and adds them as listeners
 * to the matching signals of a {@link SignalHub}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 * Beans are added in {@code @Order}/{@code Ordered} order, then in registration order.
 * Generic listener types are checked against the signal's declared argument types.
 *
 * @see SignalListener
 */
public class SignalListenerRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final SignalHub hub;

    public SignalListenerRegistrar(ListableBeanFactory beanFactory, SignalHub hub) {
        this.beanFactory = beanFactory;
        this.hub = hub;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(SignalListener.class);
        List<Map.Entry<String, Object>> ordered = new ArrayList<>(beans.entrySet());
        ordered.sort((a, b) -> AnnotationAwareOrderComparator.INSTANCE.compare(a.getValue(), b.getValue()));
        for (Map.Entry<String, Object> entry : ordered) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();
            Class<?> beanClass = ClassUtils.getUserClass(bean);

            // Proxy may hide annotation; look on the user class
            SignalListener annotation = AnnotationUtils.findAnnotation(beanClass, SignalListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @SignalListener annotation on " + beanClass.getName());
            }
            if (annotation.value().length == 0) {
                throw new BeanCreationException(beanName,
                        "@SignalListener must name at least one signal type");
            }

            for (Class<? extends Signal> signalType : annotation.value()) {
                register(beanName, bean, beanClass, resolve(beanName, signalType));
            }
        }
    }

    private AbstractSignal<?> resolve(String beanName, Class<? extends Signal> signalType) {
        Signal signal;
        try {
            signal = hub.resolve(signalType);
        } catch (SignalConfigurationException e) {
            throw new BeanCreationException(beanName,
                    "@SignalListener signal type " + signalType.getName() + " cannot be bound", e);
        }
        if (!(signal instanceof AbstractSignal<?> typed)) {
            throw new BeanCreationException(beanName,
                    "Signal " + signalType.getName() + " does not accept listeners");
        }
        return typed;
    }

    @SuppressWarnings("unchecked")
    private static void register(String beanName, Object bean, Class<?> beanClass,
            AbstractSignal<?> signal) {
        ResolvableType expected = ResolvableType.forClass(signal.getClass())
                .as(AbstractSignal.class)
                .getGeneric(0);
        if (!signal.listenerType().isInstance(bean)
                || !expected.isAssignableFrom(ResolvableType.forClass(beanClass))) {
            throw new BeanCreationException(beanName,
                    "Bean annotated with @SignalListener(" + signal.getClass().getSimpleName()
                            + ") must implement " + expected + ", but " + beanClass.getName()
                            + " does not");
        }
        ((AbstractSignal<Object>) signal).addListener(bean);
    }
}
