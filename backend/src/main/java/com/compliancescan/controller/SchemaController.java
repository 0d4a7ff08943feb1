package com.compliancescan.controller;

import com.compliancescan.exception.SchemaIntrospectionException;
import com.compliancescan.exception.TargetConnectionException;
import com.compliancescan.service.SchemaSnapshotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * 目标库结构快照
 */
@RestController
@RequestMapping("/api/schema")
@CrossOrigin(origins = "*")
public class SchemaController {

    private static final Logger log = LoggerFactory.getLogger(SchemaController.class);

    private final SchemaSnapshotService schemaSnapshotService;

    public SchemaController(SchemaSnapshotService schemaSnapshotService) {
        this.schemaSnapshotService = schemaSnapshotService;
    }

    @GetMapping
    public ResponseEntity<?> current() {
        return load(false);
    }

    /**
     * 立即重新读取目标库结构
     */
    @PostMapping("/refresh")
    public ResponseEntity<?> refresh() {
        return load(true);
    }

    private ResponseEntity<?> load(boolean refresh) {
        try {
            return ResponseEntity.ok(refresh ? schemaSnapshotService.refresh() : schemaSnapshotService.current());
        } catch (TargetConnectionException e) {
            log.warn("无法连接目标库: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (SchemaIntrospectionException e) {
            log.error("读取目标库结构失败", e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}
