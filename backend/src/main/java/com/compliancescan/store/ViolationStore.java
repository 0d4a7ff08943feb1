package com.compliancescan.store;

import com.compliancescan.model.Violation;
import com.compliancescan.model.ViolationKey;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 违规记录存储，按 (规则, 记录标识) 唯一
 */
public interface ViolationStore {

    /**
     * 全部违规记录（含已解除），按键索引
     */
    Map<ViolationKey, Violation> snapshot();

    /**
     * 按键写入或覆盖
     */
    void saveAll(Collection<Violation> violations);

    List<Violation> find(Violation.Status status, String ruleId);

    Optional<Violation> findById(String id);
}
