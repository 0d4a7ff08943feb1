package com.compliancescan.exception;

/**
 * 已有扫描在运行，新的触发被拒绝（不排队）
 */
public class ScanAlreadyRunningException extends RuntimeException {

    private final String runningScanId;

    public ScanAlreadyRunningException(String runningScanId) {
        super("已有扫描正在进行中: " + runningScanId);
        this.runningScanId = runningScanId;
    }

    public String getRunningScanId() {
        return runningScanId;
    }
}
