package net.cronhook.bootstrap.autoconfigure;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import net.cronhook.adapter.jdbc.FlywayBrokerSchema;
import net.cronhook.adapter.jdbc.JdbcTxRunner;
import net.cronhook.adapter.jdbc.repo.JdbcQueueRunRepository;
import net.cronhook.adapter.jdbc.repo.JdbcRepeatEntryRepository;
import net.cronhook.bootstrap.catalog.CatalogRegistrar;
import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.cluster.DistributedJobScheduler;
import net.cronhook.core.cluster.SharedQueue;
import net.cronhook.core.cluster.WorkerOptions;
import net.cronhook.core.local.LocalJobScheduler;
import net.cronhook.core.maintenance.QueueMaintenanceService;
import net.cronhook.core.schedule.NextRunCalculator;
import net.cronhook.core.service.JobManager;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.CronCalculator;
import net.cronhook.core.spi.JobScheduler;
import net.cronhook.core.spi.JobStore;
import net.cronhook.core.spi.TriggerAction;
import net.cronhook.integration.spring.CronhookSpringConfig;
import net.cronhook.integration.spring.cron.CronUtilsCalculator;
import net.cronhook.integration.spring.notify.HttpTriggerAction;
import net.cronhook.integration.spring.sched.CronhookSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.UUID;

@AutoConfiguration
@EnableConfigurationProperties(CronhookProperties.class)
@Import(CronhookSpringConfig.class) // integration-spring: clock/store wiring
public class CronhookAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CronhookAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    @Bean
    @ConditionalOnMissingBean(TriggerAction.class)
    public TriggerAction triggerAction(CronhookProperties props, Clock clock) {
        var notify = props.getNotify();
        return HttpTriggerAction.create(notify.getTimeout(), notify.getUserAgent(), clock);
    }

    // --- 코어 서비스 조립 ---

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public JobManager jobManager(JobStore store,
                                 JobScheduler scheduler,
                                 TriggerAction trigger,
                                 CronCalculator cron,
                                 NextRunCalculator nextRuns,
                                 Clock clock) {
        return new JobManager(store, scheduler, trigger, cron, nextRuns, clock);
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(JobManager jobManager) {
        return new CatalogRegistrar(jobManager);
    }

    @Bean
    @ConditionalOnProperty(prefix = "cronhook.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, CronhookProperties props) {
        log.info("Catalog runner enabled with {} job(s)", props.getCatalog().getJobs().size());
        return args -> registrar.register(props.getCatalog());
    }

    // --- 스케줄러 선택: 기동 시 한 번 ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cronhook.cluster", name = "enabled", havingValue = "false", matchIfMissing = true)
    static class LocalSchedulerConfig {

        @Bean
        @ConditionalOnMissingBean(JobScheduler.class)
        public LocalJobScheduler localJobScheduler(CronCalculator cron, Clock clock, CronhookProperties props) {
            return new LocalJobScheduler(cron, clock, props.getLocal().getPoolSize());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "cronhook.cluster", name = "enabled", havingValue = "true")
    @EnableScheduling
    static class ClusterSchedulerConfig {

        /** 연결은 매니저 start 시점에 확인한다. 그 전에 풀 생성이 실패하지 않도록 initializationFailTimeout = -1 */
        @Bean(destroyMethod = "close")
        public HikariDataSource cronhookBrokerDataSource(CronhookProperties props) {
            var broker = props.getCluster().getBroker();
            HikariConfig cfg = new HikariConfig();
            cfg.setPoolName("cronhook-broker");
            cfg.setJdbcUrl(broker.jdbcUrl());
            cfg.setUsername(broker.getUsername());
            cfg.setPassword(broker.getPassword());
            cfg.setMaximumPoolSize(broker.getPoolSize());
            cfg.setConnectionTimeout(broker.getConnectTimeout().toMillis());
            cfg.setInitializationFailTimeout(-1);
            return new HikariDataSource(cfg);
        }

        @Bean
        public SharedQueue sharedQueue(HikariDataSource cronhookBrokerDataSource,
                                       Clock clock,
                                       CronCalculator cron,
                                       CronhookProperties props) {
            return new SharedQueue(props.getCluster().getQueueName(),
                    new JdbcRepeatEntryRepository(),
                    new JdbcQueueRunRepository(),
                    new JdbcTxRunner(cronhookBrokerDataSource),
                    clock,
                    cron,
                    new FlywayBrokerSchema(cronhookBrokerDataSource));
        }

        @Bean
        @ConditionalOnMissingBean(JobScheduler.class)
        public DistributedJobScheduler distributedJobScheduler(SharedQueue queue, CronhookProperties props) {
            var c = props.getCluster();
            var w = c.getWorker();
            WorkerOptions options = new WorkerOptions(
                    w.getConcurrency(), w.getPollDelay(), w.getLease(), w.getBatchSize(), w.getDrainTimeout());
            return new DistributedJobScheduler(queue, options, workerId(),
                    c.getRetention().getCompleted(), c.getRetention().getFailed());
        }

        @Bean
        @ConditionalOnMissingBean
        public QueueMaintenanceService queueMaintenance(SharedQueue queue, Clock clock) {
            return new QueueMaintenanceService(queue, clock);
        }

        // 주기는 cronhook.cluster.maintenance-delay-ms 에서 읽힘
        @Bean
        public CronhookSchedulers cronhookSchedulers(QueueMaintenanceService maintenance) {
            return new CronhookSchedulers(maintenance);
        }

        static String workerId() {
            String host;
            try {
                host = InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                host = "cronhook";
            }
            return host + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
