package com.dbkeeper.server.model.api.cleanup;

import com.dbkeeper.server.model.internal.RetentionPlan;
import com.dbkeeper.server.model.internal.RetentionPolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RetentionPreviewResponse {

    private RetentionPolicy policy;

    // database name -> plan
    private Map<String, RetentionPlan> plans;

    private long totalDeleteSizeBytes;
}
