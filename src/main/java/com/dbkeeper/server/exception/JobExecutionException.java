package com.dbkeeper.server.exception;

import lombok.EqualsAndHashCode;
import org.springframework.http.HttpStatus;


/**
 * A single run of a job failed. Caught by the execution coordinator, which
 * finalizes the run as FAILED; the job stays armed for its next fire.
 */
@EqualsAndHashCode(callSuper = false)
public class JobExecutionException extends DbKeeperException {

    public JobExecutionException(String message) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message);
    }

    public JobExecutionException(String message, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, message, cause);
    }
}
