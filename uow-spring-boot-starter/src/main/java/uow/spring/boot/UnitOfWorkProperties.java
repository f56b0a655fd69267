package uow.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Isolation;

/**
 * Configuration properties for units of work.
 *
 * @see UnitOfWorkAutoConfiguration
 */
@ConfigurationProperties(prefix = "uow")
public class UnitOfWorkProperties {

    private final Transaction transaction = new Transaction();
    private final Metrics metrics = new Metrics();

    public Transaction getTransaction() {
        return transaction;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Definition of the transactions begun by the auto-configured
     * {@link uow.spring.PlatformTransactional}.
     */
    public static class Transaction {
        private Isolation isolation = Isolation.DEFAULT;

        /**
         * Timeout in seconds; -1 uses the transaction manager's default.
         */
        private int timeoutSeconds = TransactionDefinition.TIMEOUT_DEFAULT;

        private boolean readOnly = false;

        public Isolation getIsolation() {
            return isolation;
        }

        public void setIsolation(Isolation isolation) {
            this.isolation = isolation;
        }

        public int getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public boolean isReadOnly() {
            return readOnly;
        }

        public void setReadOnly(boolean readOnly) {
            this.readOnly = readOnly;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "uow";

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
