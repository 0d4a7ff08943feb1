package com.compliancescan.store;

import com.compliancescan.model.ScanRun;

import java.util.List;
import java.util.Optional;

/**
 * 扫描记录存储：开始时插入，结束时完成一次，之后不再修改
 */
public interface ScanRunStore {

    void insert(ScanRun run);

    void complete(ScanRun run);

    Optional<ScanRun> findById(String id);

    /**
     * 按开始时间倒序
     */
    List<ScanRun> findAll();
}
