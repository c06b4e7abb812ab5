package com.telemon.api.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 资源使用快照
 */
@Value
@Builder(toBuilder = true)
public class ResourceUsage {
    double cpuPercent;
    double memoryPercent;
    long memoryRss;
    long diskIoRead;
    long diskIoWrite;
    long networkRecv;
    long networkSent;
    int openFileDescriptors;
    Instant timestamp;
}
