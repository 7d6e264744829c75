package net.cronhook.bootstrap.autoconfigure;

import net.cronhook.bootstrap.catalog.CatalogRegistrar;
import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.cluster.DistributedJobScheduler;
import net.cronhook.core.cluster.SharedQueue;
import net.cronhook.core.error.SchedulerInitializationException;
import net.cronhook.core.local.LocalJobScheduler;
import net.cronhook.core.model.HttpMethod;
import net.cronhook.core.model.Job;
import net.cronhook.core.model.JobDraft;
import net.cronhook.core.service.JobManager;
import net.cronhook.core.spi.JobScheduler;
import net.cronhook.core.spi.TriggerAction;
import net.cronhook.integration.spring.cron.CronUtilsCalculator;
import net.cronhook.integration.spring.notify.HttpTriggerAction;
import net.cronhook.integration.spring.sched.CronhookSchedulers;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@TestMethodOrder(MethodOrderer.MethodName.class)
class CronhookAutoConfigurationTest {

    final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(CronhookAutoConfiguration.class));

    static String[] h2Broker(String db) {
        return new String[]{
                "cronhook.cluster.enabled=true",
                "cronhook.cluster.broker.url=jdbc:h2:mem:" + db + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1",
                "cronhook.cluster.broker.username=sa",
                "cronhook.cluster.broker.password=",
                "cronhook.cluster.worker.poll-delay=100ms"
        };
    }

    // ========== t1: 기본은 로컬 모드 ==========
    @Test
    void t1_local_mode_by_default() {
        runner.run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(JobManager.class);
            assertThat(ctx).hasSingleBean(LocalJobScheduler.class);
            assertThat(ctx).doesNotHaveBean(DistributedJobScheduler.class);
            assertThat(ctx).doesNotHaveBean(CronhookSchedulers.class);
            assertThat(ctx.getBean(TriggerAction.class)).isInstanceOf(HttpTriggerAction.class);
            assertThat(ctx.getBean(net.cronhook.core.spi.CronCalculator.class)).isInstanceOf(CronUtilsCalculator.class);

            var status = ctx.getBean(JobManager.class).getStatus();
            assertTrue(status.initialized());
            assertFalse(status.clusterMode());
            assertEquals(0, status.totalJobCount());
        });
    }

    // ========== t2: 로컬 모드에서 잡 생성 -> 타이머 등록 ==========
    @Test
    void t2_local_create_registers_timer() {
        runner.withPropertyValues("cronhook.local.pool-size=2").run(ctx -> {
            JobManager manager = ctx.getBean(JobManager.class);
            Job job = manager.createJob(new JobDraft("http://127.0.0.1:1/hook", HttpMethod.POST, "x", "*/5 * * * *", "Asia/Seoul"));

            assertEquals(1, manager.getStatus().activeLocalTaskCount());
            assertTrue(ctx.getBean(LocalJobScheduler.class).nextFireOf(job.id()).isPresent());
        });
    }

    // ========== t3: 프로퍼티 바인딩 ==========
    @Test
    void t3_properties_bind_with_defaults() {
        runner.withPropertyValues(
                "cronhook.cluster.broker.host=db.internal",
                "cronhook.cluster.broker.port=6543",
                "cronhook.notify.timeout=3s",
                "cronhook.catalog.jobs[0].uri=http://example.com/a",
                "cronhook.catalog.jobs[0].schedule=0 9 * * *"
        ).run(ctx -> {
            CronhookProperties props = ctx.getBean(CronhookProperties.class);
            assertEquals("jdbc:postgresql://db.internal:6543/cronhook", props.getCluster().getBroker().jdbcUrl());
            assertEquals(Duration.ofSeconds(10), props.getCluster().getBroker().getConnectTimeout());
            assertEquals(Duration.ofSeconds(3), props.getNotify().getTimeout());
            assertEquals("cronhook/1.0.0", props.getNotify().getUserAgent());
            assertEquals("cron-jobs", props.getCluster().getQueueName());
            assertEquals(10, props.getCluster().getRetention().getCompleted());
            assertEquals(1, props.getCatalog().getJobs().size());
            assertEquals("POST", props.getCatalog().getJobs().get(0).getHttpMethod());
        });
    }

    // ========== t4: 카탈로그 러너가 잡을 시드 ==========
    @Test
    void t4_catalog_runner_seeds_jobs() {
        runner.withPropertyValues(
                "cronhook.catalog.jobs[0].uri=http://127.0.0.1:1/a",
                "cronhook.catalog.jobs[0].http-method=get",
                "cronhook.catalog.jobs[0].schedule=*/10 * * * *",
                "cronhook.catalog.jobs[1].uri=http://127.0.0.1:1/b",
                "cronhook.catalog.jobs[1].schedule=0 9 * * *",
                "cronhook.catalog.jobs[1].time-zone=Europe/Paris"
        ).run(ctx -> {
            ctx.getBean(ApplicationRunner.class).run(new DefaultApplicationArguments());
            // 다시 돌려도 중복 생성 없음
            ctx.getBean(ApplicationRunner.class).run(new DefaultApplicationArguments());

            JobManager manager = ctx.getBean(JobManager.class);
            assertEquals(2, manager.listJobs().size());
            assertThat(manager.listJobs()).extracting(Job::httpMethod)
                    .containsExactlyInAnyOrder(HttpMethod.GET, HttpMethod.POST);
        });
    }

    // ========== t5: 카탈로그 비활성 ==========
    @Test
    void t5_catalog_disabled_has_no_runner() {
        runner.withPropertyValues("cronhook.catalog.enabled=false").run(ctx -> {
            assertThat(ctx).doesNotHaveBean(ApplicationRunner.class);
            assertThat(ctx).hasSingleBean(CatalogRegistrar.class);
        });
    }

    // ========== t6: 클러스터 모드 (H2 브로커) ==========
    @Test
    void t6_cluster_mode_uses_shared_queue() {
        runner.withPropertyValues(h2Broker("autoconf_cluster")).run(ctx -> {
            assertThat(ctx).hasNotFailed();
            assertThat(ctx).hasSingleBean(DistributedJobScheduler.class);
            assertThat(ctx).doesNotHaveBean(LocalJobScheduler.class);
            assertThat(ctx).hasSingleBean(CronhookSchedulers.class);
            assertThat(ctx.getBean(JobScheduler.class).clustered()).isTrue();

            JobManager manager = ctx.getBean(JobManager.class);
            Job job = manager.createJob(new JobDraft("http://127.0.0.1:1/hook", HttpMethod.GET, null, "0 9 * * *", "UTC"));

            var status = manager.getStatus();
            assertTrue(status.initialized());
            assertTrue(status.clusterMode());
            assertEquals(0, status.activeLocalTaskCount());

            SharedQueue queue = ctx.getBean(SharedQueue.class);
            assertEquals("cron-jobs", queue.name());
            assertEquals(DistributedJobScheduler.entryName(job.id()),
                    queue.findRepeatable(job.id()).orElseThrow().name());

            manager.deleteJob(job.id());
            assertTrue(queue.findRepeatable(job.id()).isEmpty());
        });
    }

    // ========== t7: 브로커에 닿지 못하면 기동 실패 (로컬로 떨어지지 않음) ==========
    @Test
    void t7_unreachable_broker_fails_startup() {
        runner.withPropertyValues(
                "cronhook.cluster.enabled=true",
                "cronhook.cluster.broker.host=127.0.0.1",
                "cronhook.cluster.broker.port=1",
                "cronhook.cluster.broker.username=cronhook",
                "cronhook.cluster.broker.password=cronhook",
                "cronhook.cluster.broker.connect-timeout=1s"
        ).run(ctx -> {
            assertThat(ctx).hasFailed();
            Throwable t = ctx.getStartupFailure();
            boolean found = false;
            while (t != null) {
                if (t instanceof SchedulerInitializationException) found = true;
                t = t.getCause();
            }
            assertTrue(found, "SchedulerInitializationException in cause chain");
        });
    }
}
