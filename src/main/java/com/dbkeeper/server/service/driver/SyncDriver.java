package com.dbkeeper.server.service.driver;

import com.dbkeeper.server.exception.BusinessException;
import com.dbkeeper.server.model.internal.BandwidthLimit;
import com.dbkeeper.server.model.internal.SyncResult;

public interface SyncDriver {

    /**
     * Archives the backup folder to the remote repository at the given rate,
     * then prunes and compacts the repository.
     */
    SyncResult sync(String backupPath, BandwidthLimit limit) throws BusinessException;
}
