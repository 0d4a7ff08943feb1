package com.compliancescan.controller;

import com.compliancescan.exception.ResourceNotFoundException;
import com.compliancescan.exception.ScanAlreadyRunningException;
import com.compliancescan.model.ScanRun;
import com.compliancescan.service.ReportExportService;
import com.compliancescan.service.ReportExportService.ExportPayload;
import com.compliancescan.service.ScanCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

/**
 * 合规扫描 API 控制器
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ScanController {

    private static final Logger log = LoggerFactory.getLogger(ScanController.class);

    private final ScanCoordinator scanCoordinator;
    private final ReportExportService reportExportService;

    public ScanController(ScanCoordinator scanCoordinator, ReportExportService reportExportService) {
        this.scanCoordinator = scanCoordinator;
        this.reportExportService = reportExportService;
    }

    /**
     * 手动触发一次扫描，扫描结束后返回扫描记录
     */
    @PostMapping("/scans")
    public ResponseEntity<?> triggerScan() {
        try {
            log.info("收到手动扫描请求");
            ScanRun run = scanCoordinator.triggerScan();
            return ResponseEntity.ok(run);
        } catch (ScanAlreadyRunningException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", e.getMessage(), "runningScanId", e.getRunningScanId()));
        } catch (Exception e) {
            log.error("扫描失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "扫描过程中出错: " + e.getMessage()));
        }
    }

    /**
     * 扫描历史，按开始时间倒序
     */
    @GetMapping("/scans")
    public ResponseEntity<List<ScanRun>> listScans() {
        return ResponseEntity.ok(scanCoordinator.history());
    }

    @GetMapping("/scans/{id}")
    public ResponseEntity<?> getScan(@PathVariable String id) {
        try {
            return ResponseEntity.ok(scanCoordinator.findRun(id));
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * 导出扫描记录
     *
     * @param format markdown 或 json
     */
    @GetMapping("/scans/{id}/export/{format}")
    public ResponseEntity<?> exportScan(@PathVariable String id, @PathVariable String format) {
        try {
            ScanRun run = scanCoordinator.findRun(id);
            ExportPayload payload = switch (format.toLowerCase()) {
                case "markdown", "md" -> reportExportService.exportMarkdown(run);
                case "json" -> reportExportService.exportJson(run);
                default -> throw new IllegalArgumentException("不支持的导出格式: " + format);
            };

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.parseMediaType(payload.contentType()));
            headers.setContentDisposition(ContentDisposition.attachment()
                    .filename(payload.filename(), StandardCharsets.UTF_8)
                    .build());
            return new ResponseEntity<>(payload.content(), headers, HttpStatus.OK);
        } catch (ResourceNotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("导出扫描记录失败", e);
            return ResponseEntity.internalServerError()
                    .body(Map.of("error", "导出失败: " + e.getMessage()));
        }
    }
}
