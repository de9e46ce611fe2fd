package upbus.spring.boot;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a listener on one topic.
 *
 * <p>The annotated bean must implement {@link upbus.UListener}. The topic is built from the
 * attributes; those left unset fall back to the application's own
 * {@link upbus.UriProvider}, so a bare {@code resourceId} listens on one of the
 * application's own topics.
 *
 * <pre>{@code
 * @Component
 * @TopicListener(authority = "veh", entityId = 0xA34B, resourceId = 0x8001)
 * public class SpeedListener implements UListener {
 *   public void onReceive(UMessage message) { ... }
 * }
 * }</pre>
 *
 * @see TopicListenerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TopicListener {

    /**
     * Resource id of the topic, within {@code 0x8000..0xFFFE}. Required.
     */
    int resourceId();

    /**
     * Authority of the topic. Defaults to the application's authority.
     */
    String authority() default "";

    /**
     * Entity id of the topic, within {@code 0..0xFFFFFFFF}; ids above
     * {@code Integer.MAX_VALUE} need a long literal. Defaults to the application's entity id.
     */
    long entityId() default UNSET;

    /**
     * Major version of the topic. Defaults to the application's version.
     */
    int version() default (int) UNSET;

    /**
     * Marker for an attribute left to the application's {@link upbus.UriProvider}.
     */
    long UNSET = -1;
}
