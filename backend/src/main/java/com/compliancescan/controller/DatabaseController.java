package com.compliancescan.controller;

import com.compliancescan.model.ConnectionCheck;
import com.compliancescan.service.TargetDatabase;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * 目标库连接检测
 */
@RestController
@RequestMapping("/api/database")
@CrossOrigin(origins = "*")
public class DatabaseController {

    private final TargetDatabase targetDatabase;

    public DatabaseController(TargetDatabase targetDatabase) {
        this.targetDatabase = targetDatabase;
    }

    /**
     * 检测配置的目标库能否连接，失败时返回 503 与失败类别
     */
    @GetMapping("/connection")
    public ResponseEntity<ConnectionCheck> testConnection() {
        ConnectionCheck check = targetDatabase.check();
        if (!check.reachable()) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(check);
        }
        return ResponseEntity.ok(check);
    }
}
