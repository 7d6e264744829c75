package net.cronhook.bootstrap.catalog;

import net.cronhook.bootstrap.props.CronhookProperties;
import net.cronhook.core.model.HttpMethod;
import net.cronhook.core.model.Job;
import net.cronhook.core.model.JobDraft;
import net.cronhook.core.service.JobManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 설정에 선언된 잡을 매니저에 등록한다.
 * id는 정의 내용에서 파생하므로 재기동이나 다른 인스턴스에서도 같은 잡은 같은 id를 갖는다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobManager jobs;

    public CatalogRegistrar(JobManager jobs) {
        this.jobs = jobs;
    }

    public List<Job> register(CronhookProperties.Catalog catalog) {
        List<Job> registered = new ArrayList<>();
        for (var def : catalog.getJobs()) {
            registered.add(register(def));
        }
        return registered;
    }

    private Job register(CronhookProperties.JobDef def) {
        if (def.getUri() == null || def.getSchedule() == null) {
            throw new IllegalArgumentException("job.uri and job.schedule are required");
        }
        HttpMethod method = parseMethod(def.getHttpMethod());
        JobDraft draft = new JobDraft(def.getUri(), method, def.getBody(), def.getSchedule(), def.getTimeZone());

        Job job = jobs.seedJob(stableId(draft), draft);
        log.info("Catalog registered: job={} {} {} schedule='{}'", job.id(), method, def.getUri(), def.getSchedule());
        return job;
    }

    static HttpMethod parseMethod(String raw) {
        if (raw == null || raw.isBlank()) return HttpMethod.POST;
        try {
            return HttpMethod.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported httpMethod: " + raw, e);
        }
    }

    static String stableId(JobDraft d) {
        String key = d.httpMethod() + "|" + d.uri() + "|" + d.schedule() + "|" + d.timeZone() + "|" + d.body();
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
