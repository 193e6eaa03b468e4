package chatfeed.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the message change feed.
 *
 * @see ChatfeedAutoConfiguration
 */
@ConfigurationProperties(prefix = "chatfeed")
public class ChatfeedProperties {

    /**
     * Whether the change feed is configured at all.
     */
    private boolean enabled = true;

    /**
     * Connect the listener when the application context starts.
     */
    private boolean autoConnect = true;

    /**
     * Fail application startup when the initial connect fails. When false the failure
     * is logged and the listener stays disconnected.
     */
    private boolean failFast = false;

    /**
     * Notification channel shared by the trigger and the listener.
     */
    private String channel = "message_changes";

    /**
     * Table the change trigger is attached to.
     */
    private String tableName = "messages";

    private String functionName = "notify_message_change";

    private String triggerName = "messages_notify_trigger";

    /**
     * Install (or replace) the trigger function and trigger on every connect.
     */
    private boolean installTriggers = true;

    /**
     * How long one receive call waits for notifications before checking for shutdown.
     */
    private int pollTimeoutMs = 500;

    private final Reconnect reconnect = new Reconnect();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoConnect() {
        return autoConnect;
    }

    public void setAutoConnect(boolean autoConnect) {
        this.autoConnect = autoConnect;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setFunctionName(String functionName) {
        this.functionName = functionName;
    }

    public String getTriggerName() {
        return triggerName;
    }

    public void setTriggerName(String triggerName) {
        this.triggerName = triggerName;
    }

    public boolean isInstallTriggers() {
        return installTriggers;
    }

    public void setInstallTriggers(boolean installTriggers) {
        this.installTriggers = installTriggers;
    }

    public int getPollTimeoutMs() {
        return pollTimeoutMs;
    }

    public void setPollTimeoutMs(int pollTimeoutMs) {
        this.pollTimeoutMs = pollTimeoutMs;
    }

    public Reconnect getReconnect() {
        return reconnect;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Reconnect {
        /**
         * Delay before the first reconnect attempt after a lost connection.
         */
        private long initialDelayMs = 5000;

        /**
         * Delay before every later attempt.
         */
        private long retryDelayMs = 10000;

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getRetryDelayMs() {
            return retryDelayMs;
        }

        public void setRetryDelayMs(long retryDelayMs) {
            this.retryDelayMs = retryDelayMs;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "chatfeed";

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
