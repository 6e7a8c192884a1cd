package org.cronpulse.jobs;

import org.cronpulse.utils.HttpRequestUtil;

import java.util.Map;

/**
 * Job creation input. Nullable fields get their defaults applied by {@link JobService}.
 */
public record JobCreateRequest(
        String ownerId,
        String name,
        String cronExpression,
        String timezone,
        String jobType,
        String integration,
        Map<String, Object> action,
        Boolean enabled
) {

    public static JobCreateRequest fromBody(Map<String, Object> body) {
        Object enabled = body.get("enabled");
        return new JobCreateRequest(
                HttpRequestUtil.getString(body, "owner_id"),
                HttpRequestUtil.getString(body, "name"),
                HttpRequestUtil.getString(body, "cron_expression"),
                HttpRequestUtil.getString(body, "timezone"),
                HttpRequestUtil.getString(body, "job_type"),
                HttpRequestUtil.getString(body, "integration"),
                HttpRequestUtil.getMap(body, "action"),
                enabled == null ? null : Boolean.valueOf(enabled.toString())
        );
    }
}
