package com.yerin.stylizer.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 작업 큐 설정. 운영 환경 변수(MAX_CONCURRENT_JOBS, MAX_QUEUE_SIZE, JOB_TIMEOUT,
 * JOB_RESULT_TTL)는 application.yml 에서 이 속성들로 연결된다.
 */
@Getter
@Validated
@ConfigurationProperties(prefix = "jobq")
public class JobqProperties {

    @Valid
    private final Worker worker = new Worker();

    @Valid
    private final Queue queue = new Queue();

    @Valid
    private final Result result = new Result();

    @Valid
    private final Reaper reaper = new Reaper();

    @Valid
    private final Registry registry = new Registry();

    @Valid
    private final Upload upload = new Upload();

    @Valid
    private final Defaults defaults = new Defaults();

    private final Admin admin = new Admin();

    @Getter
    @Setter
    public static class Worker {
        /** 동시에 실행 가능한 슬롯 수. */
        @Min(1)
        private int concurrency = 2;

        /** Generator 호출 제한 시간. 단위 없는 값은 초. */
        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration timeout = Duration.ofSeconds(600);

        /** lease = startTime + timeout + leaseGrace */
        @NotNull
        private Duration leaseGrace = Duration.ofSeconds(30);

        /** 빈 큐에서 슬롯이 한 번에 기다리는 최대 시간. */
        @NotNull
        private Duration pollInterval = Duration.ofMillis(500);
    }

    @Getter
    @Setter
    public static class Queue {
        /** queued + processing 상한. */
        @Min(1)
        private int maxSize = 10;
    }

    @Getter
    @Setter
    public static class Result {
        @NotBlank
        private String dir = "generated_images";

        @NotNull
        @DurationUnit(ChronoUnit.SECONDS)
        private Duration ttl = Duration.ofSeconds(900);

        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Reaper {
        @NotNull
        private Duration interval = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Registry {
        /** 종료된 작업 레코드 보존 기간. 0 이면 삭제하지 않는다. */
        @NotNull
        private Duration retention = Duration.ZERO;
    }

    @Getter
    @Setter
    public static class Upload {
        @NotEmpty
        private Set<String> allowedExtensions = new LinkedHashSet<>(List.of("png", "jpg", "jpeg", "webp"));
    }

    @Getter
    @Setter
    public static class Defaults {
        @Min(1)
        private int width = 1024;
        @Min(1)
        private int height = 1024;
        @Min(1)
        private int steps = 28;
        @DecimalMin("0.0")
        private double guidanceScale = 2.5;
        @DecimalMin("0.0")
        private double trueCfgScale = 1.5;
    }

    @Getter
    @Setter
    public static class Admin {
        private String token = "";
    }

    public Duration leaseDuration() {
        return worker.getTimeout().plus(worker.getLeaseGrace());
    }
}
