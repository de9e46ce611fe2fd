/**
 * Spring Boot auto-configuration: transport, publisher and notifier beans configured from
 * {@code upbus.*} properties, plus {@link upbus.spring.boot.TopicListener} registration.
 */
package upbus.spring.boot;
