package com.yerin.stylizer.controller;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.JobStatus;
import com.yerin.stylizer.repository.JobRegistry;
import com.yerin.stylizer.service.AdmissionGate;
import io.swagger.v3.oas.annotations.Parameter;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/admin/metrics")
@RequiredArgsConstructor
public class AdminMetricsController {

    private final AdmissionGate admissionGate;
    private final JobRegistry jobRegistry;
    private final JobqProperties properties;
    private final Clock clock;

    @GetMapping("/queue")
    public Map<String, Object> queue(@RequestHeader(value = "X-Admin-Token", required = true)
                                     @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                     String adminToken) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("queued", admissionGate.queuedCount());
        out.put("processing", admissionGate.processingCount());
        out.put("capacity", admissionGate.capacity());
        out.put("concurrency", properties.getWorker().getConcurrency());
        out.put("admittedTotal", admissionGate.admittedTotal());
        out.put("dequeuedTotal", admissionGate.dequeuedTotal());
        out.put("queuedJobIds", admissionGate.queueSnapshot());
        out.put("ts", clock.instant().toString());
        return out;
    }

    @GetMapping("/jobs")
    public Map<String, Long> jobCounts(@RequestHeader(value = "X-Admin-Token", required = true)
                                       @Parameter(description = "관리자 토큰", example = "test-admin-token")
                                       String adminToken) {
        Map<String, Long> out = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            out.put(status.name(), jobRegistry.countByStatus(status));
        }
        return out;
    }
}
