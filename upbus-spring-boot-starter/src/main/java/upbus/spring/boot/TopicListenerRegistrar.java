package upbus.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import upbus.TransportException;
import upbus.UListener;
import upbus.UTransport;
import upbus.UUri;
import upbus.UriProvider;
import upbus.registry.ListenerRegistration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link TopicListener} and registers them with the
 * {@link UTransport}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see TopicListener
 */
public class TopicListenerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(TopicListenerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final UTransport transport;
    private final UriProvider uriProvider;
    private final List<ListenerRegistration> registrations = new ArrayList<>();

    public TopicListenerRegistrar(ListableBeanFactory beanFactory, UTransport transport, UriProvider uriProvider) {
        this.beanFactory = beanFactory;
        this.transport = transport;
        this.uriProvider = uriProvider;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(TopicListener.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof UListener listener)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @TopicListener must implement UListener, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            TopicListener annotation = AnnotationUtils.findAnnotation(bean.getClass(), TopicListener.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @TopicListener annotation on " + bean.getClass().getName());
            }

            UUri topic = resolveTopic(beanName, annotation);
            try {
                registrations.add(transport.registerListener(topic, listener));
            } catch (TransportException e) {
                throw new BeanCreationException(beanName, "Failed to register listener on " + topic, e);
            }
            logger.fine(() -> "Registered bean '" + beanName + "' on " + topic);
        }
    }

    /**
     * Returns the registrations made for annotated beans.
     *
     * @return an unmodifiable view of the registrations
     */
    public List<ListenerRegistration> registrations() {
        return Collections.unmodifiableList(registrations);
    }

    private UUri resolveTopic(String beanName, TopicListener annotation) {
        UUri own = uriProvider.getSourceUri();
        String authority = annotation.authority().isEmpty() ? own.authority() : annotation.authority();
        int entityId = annotation.entityId() == TopicListener.UNSET
                ? own.entityId() : toEntityId(beanName, annotation.entityId());
        int version = annotation.version() == TopicListener.UNSET ? own.version() : annotation.version();

        UUri topic;
        try {
            topic = new UUri(authority, entityId, version, annotation.resourceId());
        } catch (IllegalArgumentException e) {
            throw new BeanCreationException(beanName, "Invalid @TopicListener topic: " + e.getMessage(), e);
        }
        if (!topic.isTopic()) {
            throw new BeanCreationException(beanName,
                    "@TopicListener resolves to " + topic + ", which is not a topic");
        }
        return topic;
    }

    private static int toEntityId(String beanName, long entityId) {
        if (entityId < 0 || entityId > 0xFFFF_FFFFL) {
            throw new BeanCreationException(beanName,
                    "@TopicListener entityId must be within 0..0xFFFFFFFF: " + entityId);
        }
        return (int) entityId;
    }
}
