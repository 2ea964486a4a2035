package com.yerin.stylizer.infra;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.JobqMetrics;
import com.yerin.stylizer.repository.JobRegistry;
import com.yerin.stylizer.storage.ResultStore;
import com.yerin.stylizer.storage.ResultStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

@Slf4j
@Component
@RequiredArgsConstructor
public class ResultCleanupScheduler {

    private final ResultStore resultStore;
    private final JobRegistry registry;
    private final JobqMetrics metrics;
    private final JobqProperties properties;
    private final Clock clock;

    @Scheduled(
            initialDelayString = "${jobq.result.sweep-interval:PT60S}",
            fixedDelayString = "${jobq.result.sweep-interval:PT60S}")
    public void cleanup() {
        Duration ttl = properties.getResult().getTtl();
        try {
            int swept = resultStore.sweep(ttl);
            if (swept > 0) {
                metrics.incSwept(swept);
                log.info("[Cleanup] swept {} expired results (ttl={})", swept, ttl);
            }
        } catch (ResultStoreException e) {
            log.error("[Cleanup] result sweep failed", e);
        }

        Duration retention = properties.getRegistry().getRetention();
        if (!retention.isZero() && !retention.isNegative()) {
            int purged = registry.deleteFinishedBefore(clock.instant().minus(retention));
            if (purged > 0) {
                log.info("[Cleanup] purged {} finished job records (retention={})", purged, retention);
            }
        }
    }
}
