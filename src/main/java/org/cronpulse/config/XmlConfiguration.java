package org.cronpulse.config;

import jakarta.xml.bind.annotation.XmlElement;
import jakarta.xml.bind.annotation.XmlElementWrapper;
import jakarta.xml.bind.annotation.XmlRootElement;

import java.util.ArrayList;
import java.util.List;

@XmlRootElement(name = "configuration")
public class XmlConfiguration {

    public Server server;
    public DataSource dataSource;
    public ConnectionPool connectionPool;
    public Storage storage = new Storage();
    public Scheduler scheduler = new Scheduler();

    @XmlElementWrapper(name = "rateLimits")
    @XmlElement(name = "integration")
    public List<IntegrationLimit> rateLimits = new ArrayList<>();

    // --- Undertow Server ---
    @XmlRootElement(name = "server")
    public static class Server {
        public String host = "0.0.0.0";
        public int port = 8090;
        public int ioThreads = 2;
        public int workerThreads = 16;
        public String basePath = "/api/v1";
        public String allowedOrigins = "";
    }

    // --- Data Source ---
    @XmlRootElement(name = "dataSource")
    public static class DataSource {
        public String driverClassName;
        public String jdbcUrl;
        public String username;
        public String password;
        public boolean encrypt;
    }

    // --- HikariCP Connection Pool ---
    @XmlRootElement(name = "connectionPool")
    public static class ConnectionPool {
        public int maximumPoolSize = 10;
        public int minimumIdle = 2;
        public long idleTimeout = 600000;
        public long connectionTimeout = 5000;
        public long maxLifetime = 1800000;
    }

    // --- Job / usage / policy storage ---
    @XmlRootElement(name = "storage")
    public static class Storage {
        /** postgres | memory */
        public String mode = "postgres";
        public boolean initSchema = true;
    }

    // --- Dispatch loop ---
    @XmlRootElement(name = "scheduler")
    public static class Scheduler {
        public int pollIntervalSeconds = 60;
        public int batchLimit = 50;
        public int workerThreads = 4;
        public int handlerTimeoutSeconds = 30;
        public int shutdownGraceSeconds = 45;
        public int policyCacheSeconds = 5;
        public String backoffScheduleSeconds = "30,60,300,900,3600";
    }

    // --- Per-integration default limits ---
    public static class IntegrationLimit {
        public String name;
        public int maxCallsPerHour;
        public int maxCallsPerDay;
        public boolean failClosed;
    }
}
