package signals.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import signals.dispatch.RedispatchPolicy;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the signal hub.
 *
 * @see SignalsAutoConfiguration
 */
@ConfigurationProperties(prefix = "signals")
public class SignalsProperties {

    /**
     * What a dispatch does when the signal is already running or paused.
     */
    private RedispatchPolicy redispatchPolicy = RedispatchPolicy.REJECT;

    /**
     * Log every dispatch through a LoggingDispatchObserver, unless a
     * DispatchObserver bean is defined.
     */
    private boolean logDispatches = false;

    /**
     * Fully qualified signal class names bound when the hub is created.
     */
    private List<String> preload = new ArrayList<>();

    public RedispatchPolicy getRedispatchPolicy() {
        return redispatchPolicy;
    }

    public void setRedispatchPolicy(RedispatchPolicy redispatchPolicy) {
        this.redispatchPolicy = redispatchPolicy;
    }

    public boolean isLogDispatches() {
        return logDispatches;
    }

    public void setLogDispatches(boolean logDispatches) {
        this.logDispatches = logDispatches;
    }

    public List<String> getPreload() {
        return preload;
    }

    public void setPreload(List<String> preload) {
        this.preload = preload;
    }
}
