package com.compliancescan.store;

import com.compliancescan.model.ReviewItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 人工复核队列：无法翻译或查询被拒绝的规则。同一规则只保留最近一次原因。
 */
@Component
public class ReviewQueue {

    private static final Logger log = LoggerFactory.getLogger(ReviewQueue.class);

    private final Map<String, ReviewItem> items = new LinkedHashMap<>();

    public synchronized void flag(ReviewItem item) {
        items.remove(item.ruleId());
        items.put(item.ruleId(), item);
        log.warn("规则 {} 需要人工复核: {} - {}", item.ruleCode(), item.kind(), item.reason());
    }

    /**
     * 规则成功执行后移出队列
     */
    public synchronized void clear(String ruleId) {
        items.remove(ruleId);
    }

    public synchronized List<ReviewItem> list() {
        return new ArrayList<>(items.values());
    }
}
