package com.dbkeeper.server.service.executor;

import com.dbkeeper.server.enums.JobKindEnum;
import com.dbkeeper.server.exception.JobExecutionException;
import com.dbkeeper.server.model.internal.RunMetrics;
import com.dbkeeper.server.model.internal.ScheduledJob;

/**
 * One strategy per job kind. Implementations talk to their driver, translate
 * driver failures into {@link JobExecutionException} and report metrics for
 * the run history. Per item problems that did not abort the run go into
 * {@link RunMetrics#getErrors()}.
 */
public interface JobExecutor {

    JobKindEnum kind();

    RunMetrics run(ScheduledJob job) throws JobExecutionException;
}
