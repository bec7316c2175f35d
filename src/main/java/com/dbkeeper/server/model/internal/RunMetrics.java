package com.dbkeeper.server.model.internal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import org.apache.commons.collections4.CollectionUtils;

import java.util.ArrayList;
import java.util.List;

@Data
public class RunMetrics {

    private long durationMillis;

    private Long sizeBytes;

    private Long bytesDeduplicated;

    private Integer filesAffected;

    private String filePath;

    private String message;

    // per item failures, a non empty list finalizes the run as PARTIAL
    private List<String> errors = new ArrayList<>();

    @JsonIgnore
    public boolean hasErrors() {
        return CollectionUtils.isNotEmpty(this.errors);
    }
}
