package io.cronjob4j.config;

import io.cronjob4j.internal.mongo.JobExecutionDocument;
import io.cronjob4j.internal.mongo.ScheduledJobDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the scheduler collections.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at application startup unless
 * {@code cronjob.ensure-indexes-on-startup=true}. In production they are usually managed by migrations.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>ux_name</b> on {@code scheduled_jobs}: { name: 1 }, unique
 *       <br/>Enforces definition name uniqueness.</li>
 *   <li><b>idx_due</b> on {@code scheduled_jobs}: { enabled: 1, nextRunAt: 1 }
 *       <br/>Used by the due-job poll.</li>
 *   <li><b>idx_job_started</b> on {@code job_executions}: { jobId: 1, startedAt: -1 }
 *       <br/>Execution history per job and cascade delete.</li>
 *   <li><b>idx_status</b> on {@code job_executions}: { status: 1 }</li>
 *   <li><b>idx_started</b> on {@code job_executions}: { startedAt: 1 }
 *       <br/>Retention cleanup.</li>
 *   <li><b>ux_execution_id</b> on {@code job_executions}: { executionId: 1 }, unique</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.scheduled_jobs.createIndex({ name: 1 }, { name: "ux_name", unique: true });
 * db.scheduled_jobs.createIndex({ enabled: 1, nextRunAt: 1 }, { name: "idx_due" });
 * db.job_executions.createIndex({ jobId: 1, startedAt: -1 }, { name: "idx_job_started" });
 * db.job_executions.createIndex({ status: 1 }, { name: "idx_status" });
 * db.job_executions.createIndex({ startedAt: 1 }, { name: "idx_started" });
 * db.job_executions.createIndex({ executionId: 1 }, { name: "ux_execution_id", unique: true });
 * </pre>
 */
public class CronJobMongoIndexConfig {

    public static final String UX_NAME = "ux_name";
    public static final String IDX_DUE = "idx_due";
    public static final String IDX_JOB_STARTED = "idx_job_started";
    public static final String IDX_STATUS = "idx_status";
    public static final String IDX_STARTED = "idx_started";
    public static final String UX_EXECUTION_ID = "ux_execution_id";

    private final MongoTemplate mongoTemplate;

    public CronJobMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create every required index. Safe to call repeatedly.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(uniqueNameIndex());
        mongoTemplate.indexOps(ScheduledJobDocument.class).ensureIndex(dueIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(jobStartedIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(statusIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(startedIndex());
        mongoTemplate.indexOps(JobExecutionDocument.class).ensureIndex(uniqueExecutionIdIndex());
    }

    public static Index uniqueNameIndex() {
        return new Index()
                .on("name", Sort.Direction.ASC)
                .unique()
                .named(UX_NAME);
    }

    /**
     * Keys: enabled ASC, nextRunAt ASC
     */
    public static Index dueIndex() {
        return new Index()
                .on("enabled", Sort.Direction.ASC)
                .on("nextRunAt", Sort.Direction.ASC)
                .named(IDX_DUE);
    }

    /**
     * Keys: jobId ASC, startedAt DESC
     */
    public static Index jobStartedIndex() {
        return new Index()
                .on("jobId", Sort.Direction.ASC)
                .on("startedAt", Sort.Direction.DESC)
                .named(IDX_JOB_STARTED);
    }

    public static Index statusIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .named(IDX_STATUS);
    }

    public static Index startedIndex() {
        return new Index()
                .on("startedAt", Sort.Direction.ASC)
                .named(IDX_STARTED);
    }

    public static Index uniqueExecutionIdIndex() {
        return new Index()
                .on("executionId", Sort.Direction.ASC)
                .unique()
                .named(UX_EXECUTION_ID);
    }
}
