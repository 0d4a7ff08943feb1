package com.compliancescan.store;

import com.compliancescan.model.ScanRun;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 内存扫描记录存储
 */
@Component
public class InMemoryScanRunStore implements ScanRunStore {

    private final Map<String, ScanRun> runs = new LinkedHashMap<>();

    @Override
    public synchronized void insert(ScanRun run) {
        if (runs.containsKey(run.getId())) {
            throw new IllegalStateException("扫描记录已存在: " + run.getId());
        }
        runs.put(run.getId(), copy(run));
    }

    @Override
    public synchronized void complete(ScanRun run) {
        ScanRun existing = runs.get(run.getId());
        if (existing == null) {
            throw new IllegalStateException("扫描记录不存在: " + run.getId());
        }
        if (!existing.isRunning()) {
            throw new IllegalStateException("扫描记录已结束，不能再次修改: " + run.getId());
        }
        runs.put(run.getId(), copy(run));
    }

    @Override
    public synchronized Optional<ScanRun> findById(String id) {
        return Optional.ofNullable(runs.get(id)).map(InMemoryScanRunStore::copy);
    }

    @Override
    public synchronized List<ScanRun> findAll() {
        return runs.values().stream()
                .sorted(Comparator.comparing(ScanRun::getStartedAt).reversed())
                .map(InMemoryScanRunStore::copy)
                .toList();
    }

    private static ScanRun copy(ScanRun run) {
        return run.toBuilder().outcomes(new ArrayList<>(run.getOutcomes())).build();
    }
}
