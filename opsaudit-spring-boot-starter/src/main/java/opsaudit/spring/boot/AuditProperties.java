package opsaudit.spring.boot;

import opsaudit.AuditConfig;
import opsaudit.jdbc.DatabaseConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for the audit pipeline.
 *
 * @see AuditAutoConfiguration
 */
@ConfigurationProperties(prefix = "opsaudit")
public class AuditProperties {

    /**
     * Whether interactions are recorded at all.
     */
    private boolean enabled = false;

    private final Database database = new Database();
    private final Async async = new Async();
    private final Retention retention = new Retention();
    private final Schema schema = new Schema();
    private final Metrics metrics = new Metrics();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Database getDatabase() {
        return database;
    }

    public Async getAsync() {
        return async;
    }

    public Retention getRetention() {
        return retention;
    }

    public Schema getSchema() {
        return schema;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /** Pipeline settings as the core configuration type. */
    public AuditConfig toAuditConfig() {
        AuditConfig config = new AuditConfig()
            .setEnabled(enabled)
            .setWorkers(async.getWorkers())
            .setQueueSize(async.getQueueSize())
            .setBatchSize(async.getBatchSize())
            .setBatchInterval(async.getBatchInterval())
            .setDrainTimeout(async.getDrainTimeout());
        config.getRetention()
            .setDays(retention.getDays())
            .setAutoCleanup(retention.isAutoCleanup())
            .setCleanupTime(retention.getCleanupTime());
        if (retention.getZone() != null && !retention.getZone().isBlank()) {
            config.getRetention().setZone(ZoneId.of(retention.getZone()));
        }
        return config;
    }

    /** Connection settings as the JDBC configuration type. */
    public DatabaseConfig toDatabaseConfig() {
        return new DatabaseConfig()
            .setDriver(database.getDriver())
            .setHost(database.getHost())
            .setPort(database.getPort())
            .setUser(database.getUser())
            .setPassword(database.getPassword())
            .setDbName(database.getDbName())
            .setSslMode(database.getSslMode())
            .setMaxOpenConns(database.getMaxOpenConns())
            .setMaxIdleConns(database.getMaxIdleConns())
            .setConnMaxLifetime(database.getConnMaxLifetime())
            .setConnectTimeout(database.getConnectTimeout());
    }

    /**
     * Dedicated audit database. When {@code host} is empty the application's
     * {@link javax.sql.DataSource} is used instead.
     */
    public static class Database {
        private String driver = "postgresql";
        private String host;
        private int port = 5432;
        private String user;
        private String password;
        private String dbName;
        private String sslMode = "disable";
        private int maxOpenConns = 10;
        private int maxIdleConns = 2;
        private Duration connMaxLifetime = Duration.ofHours(1);
        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getDriver() {
            return driver;
        }

        public void setDriver(String driver) {
            this.driver = driver;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public String getUser() {
            return user;
        }

        public void setUser(String user) {
            this.user = user;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getDbName() {
            return dbName;
        }

        public void setDbName(String dbName) {
            this.dbName = dbName;
        }

        public String getSslMode() {
            return sslMode;
        }

        public void setSslMode(String sslMode) {
            this.sslMode = sslMode;
        }

        public int getMaxOpenConns() {
            return maxOpenConns;
        }

        public void setMaxOpenConns(int maxOpenConns) {
            this.maxOpenConns = maxOpenConns;
        }

        public int getMaxIdleConns() {
            return maxIdleConns;
        }

        public void setMaxIdleConns(int maxIdleConns) {
            this.maxIdleConns = maxIdleConns;
        }

        public Duration getConnMaxLifetime() {
            return connMaxLifetime;
        }

        public void setConnMaxLifetime(Duration connMaxLifetime) {
            this.connMaxLifetime = connMaxLifetime;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Async {
        private int workers = 2;
        private int queueSize = 1000;
        private int batchSize = 10;
        private Duration batchInterval = Duration.ofSeconds(5);
        private Duration drainTimeout = Duration.ofSeconds(30);

        public int getWorkers() {
            return workers;
        }

        public void setWorkers(int workers) {
            this.workers = workers;
        }

        public int getQueueSize() {
            return queueSize;
        }

        public void setQueueSize(int queueSize) {
            this.queueSize = queueSize;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public Duration getBatchInterval() {
            return batchInterval;
        }

        public void setBatchInterval(Duration batchInterval) {
            this.batchInterval = batchInterval;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    public static class Retention {
        private int days = 30;
        private boolean autoCleanup = false;
        /**
         * Local time of the daily sweep, {@code H:mm}.
         */
        private String cleanupTime = "03:00";
        /**
         * Zone the cleanup time is read in; the system zone when empty.
         */
        private String zone;

        public int getDays() {
            return days;
        }

        public void setDays(int days) {
            this.days = days;
        }

        public boolean isAutoCleanup() {
            return autoCleanup;
        }

        public void setAutoCleanup(boolean autoCleanup) {
            this.autoCleanup = autoCleanup;
        }

        public String getCleanupTime() {
            return cleanupTime;
        }

        public void setCleanupTime(String cleanupTime) {
            this.cleanupTime = cleanupTime;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Schema {
        /**
         * Create missing audit tables on start-up.
         */
        private boolean provision = false;

        public boolean isProvision() {
            return provision;
        }

        public void setProvision(boolean provision) {
            this.provision = provision;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "opsaudit";

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
