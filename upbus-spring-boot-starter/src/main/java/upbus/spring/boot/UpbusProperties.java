package upbus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import upbus.network.udp.UdpMulticastSession;

/**
 * Configuration properties for upbus.
 *
 * @see UpbusAutoConfiguration
 */
@ConfigurationProperties(prefix = "upbus")
public class UpbusProperties {

    /**
     * Authority (device or host name) of this application.
     */
    private String authority = "local";

    /**
     * Entity id of this application, an unsigned 32-bit value ({@code 0..4294967295}).
     */
    private long entityId = 0;

    /**
     * Major version of this application's entity.
     */
    private int version = 1;

    /**
     * Transport implementation: in-process or over the network.
     */
    private TransportKind transport = TransportKind.LOCAL;

    private final Network network = new Network();
    private final Metrics metrics = new Metrics();

    public String getAuthority() {
        return authority;
    }

    public void setAuthority(String authority) {
        this.authority = authority;
    }

    public long getEntityId() {
        return entityId;
    }

    public void setEntityId(long entityId) {
        this.entityId = entityId;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public TransportKind getTransport() {
        return transport;
    }

    public void setTransport(TransportKind transport) {
        this.transport = transport;
    }

    public Network getNetwork() {
        return network;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public enum TransportKind {
        LOCAL,
        NETWORK
    }

    public static class Network {
        /**
         * Multicast group joined by the network transport.
         */
        private String group = UdpMulticastSession.DEFAULT_GROUP;

        /**
         * UDP port of the multicast group.
         */
        private int port = UdpMulticastSession.DEFAULT_PORT;

        /**
         * Multicast time-to-live; 1 keeps traffic on the local subnet.
         */
        private int ttl = UdpMulticastSession.DEFAULT_TTL;

        public String getGroup() {
            return group;
        }

        public void setGroup(String group) {
            this.group = group;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getTtl() {
            return ttl;
        }

        public void setTtl(int ttl) {
            this.ttl = ttl;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "upbus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
