package hookpoint.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for hookpoint.
 *
 * @see HookpointAutoConfiguration
 * @see HookpointMicrometerAutoConfiguration
 */
@ConfigurationProperties(prefix = "hookpoint")
public class HookpointProperties {

    private final Registrar registrar = new Registrar();
    private final Metrics metrics = new Metrics();

    public Registrar getRegistrar() {
        return registrar;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Registrar {
        /**
         * Whether beans annotated with {@code @HookComponent} are registered automatically.
         */
        private boolean enabled = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "hookpoint";

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
