package com.yerin.stylizer.storage;

import com.yerin.stylizer.domain.ResultArtifact;
import com.yerin.stylizer.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@DisplayName("FileSystemResultStore 테스트")
class FileSystemResultStoreTest {

    @TempDir
    Path dir;

    MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    FileSystemResultStore sut;

    @BeforeEach
    void setUp() {
        sut = new FileSystemResultStore(dir, Duration.ofMinutes(15), clock);
    }

    @Test
    @DisplayName("저장한 바이트를 그대로 읽고 생성 시각은 서비스 시계를 따른다")
    void put_then_get() {
        byte[] payload = {1, 2, 3, 4};

        String ref = sut.put("job-1", payload);
        ResultArtifact artifact = sut.get("job-1").orElseThrow();

        assertThat(ref).endsWith("job-1.png");
        assertThat(Path.of(ref)).exists();
        assertThat(artifact.payload()).containsExactly(1, 2, 3, 4);
        assertThat(artifact.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    @DisplayName("없는 결과는 empty")
    void get_missing() {
        assertThat(sut.get("nope")).isEmpty();
    }

    @Test
    @DisplayName("TTL 이 지난 결과는 sweep 전이라도 조회되지 않는다")
    void expired_is_hidden() {
        sut.put("job-1", new byte[]{9});

        clock.advance(Duration.ofMinutes(15));
        assertThat(sut.get("job-1")).isPresent();

        clock.advance(Duration.ofSeconds(1));
        assertThat(sut.get("job-1")).isEmpty();
    }

    @Test
    @DisplayName("sweep 은 만료된 결과만 지우고 삭제 건수를 돌려준다")
    void sweep_deletes_only_expired() {
        sut.put("old-1", new byte[]{1});
        sut.put("old-2", new byte[]{2});
        clock.advance(Duration.ofMinutes(10));
        sut.put("fresh", new byte[]{3});
        clock.advance(Duration.ofMinutes(6));

        int deleted = sut.sweep(Duration.ofMinutes(15));

        assertThat(deleted).isEqualTo(2);
        assertThat(dir.resolve("old-1.png")).doesNotExist();
        assertThat(dir.resolve("old-2.png")).doesNotExist();
        assertThat(sut.get("fresh")).isPresent();
        assertThat(sut.sweep(Duration.ofMinutes(15))).isZero();
    }

    @Test
    @DisplayName("같은 ID 로 다시 쓰면 내용과 생성 시각이 교체된다")
    void overwrite_replaces() {
        sut.put("job-1", new byte[]{1});
        clock.advance(Duration.ofMinutes(14));
        sut.put("job-1", new byte[]{2, 2});
        clock.advance(Duration.ofMinutes(5));

        assertThat(sut.sweep(Duration.ofMinutes(15))).isZero();
        assertThat(sut.get("job-1")).get().extracting(ResultArtifact::size).isEqualTo(2);
    }

    @Test
    @DisplayName("쓰기 후 임시 파일이 남지 않고, sweep 은 png 외 파일을 건드리지 않는다")
    void no_temp_files_left() throws IOException {
        sut.put("job-1", new byte[]{1});
        Path stray = Files.writeString(dir.resolve("notes.txt"), "keep");
        clock.advance(Duration.ofHours(1));

        sut.sweep(Duration.ofMinutes(15));

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(stray);
        }
    }

    @Test
    @DisplayName("delete 는 존재 여부를 돌려준다")
    void delete_reports_presence() {
        sut.put("job-1", new byte[]{1});

        assertThat(sut.delete("job-1")).isTrue();
        assertThat(sut.delete("job-1")).isFalse();
    }

    @Test
    @DisplayName("경로 조작이 가능한 ID 는 거부")
    void rejects_unsafe_id() {
        assertThatThrownBy(() -> sut.put("../etc/passwd", new byte[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("디렉터리가 없으면 sweep 은 0")
    void sweep_without_dir() {
        var store = new FileSystemResultStore(dir.resolve("missing"), Duration.ofMinutes(1), clock);

        assertThat(store.sweep(Duration.ofMinutes(1))).isZero();
    }
    @Test
    @DisplayName("중단된 쓰기가 남긴 임시 파일은 TTL 이 지나면 sweep 이 지운다")
    void sweep_removes_stale_temp_files() throws IOException {
        Path stale = Files.write(dir.resolve(".job-1-12345.part"), new byte[]{1});
        Files.setLastModifiedTime(stale, FileTime.from(clock.instant().minus(Duration.ofHours(1))));
        Path fresh = Files.write(dir.resolve(".job-2-67890.part"), new byte[]{2});
        Files.setLastModifiedTime(fresh, FileTime.from(clock.instant()));

        int deleted = sut.sweep(Duration.ofMinutes(15));

        assertThat(deleted).isZero();
        assertThat(stale).doesNotExist();
        assertThat(fresh).exists();
    }

    @Test
    @DisplayName("임시 파일 이름에서 작업 ID 를 꺼낸다")
    void job_id_of_temp_name() {
        assertThat(FileSystemResultStore.jobIdOfTemp(".3f2a-bc-9911.part")).isEqualTo("3f2a-bc");
        assertThat(FileSystemResultStore.jobIdOfTemp("job-1.png")).isNull();
        assertThat(FileSystemResultStore.jobIdOfTemp(".-1.part")).isNull();
    }

    @Test
    @DisplayName("동시 put/get/sweep 에서도 읽기는 비었거나 완전한 결과이고 임시 파일이 남지 않는다")
    void concurrent_put_get_and_sweep() throws Exception {
        Duration ttl = Duration.ofMinutes(15);
        List<String> ids = List.of("job-a", "job-b");
        int size = 8192;
        AtomicBoolean stop = new AtomicBoolean();
        Queue<String> problems = new ConcurrentLinkedQueue<>();
        ExecutorService pool = Executors.newFixedThreadPool(ids.size() * 2 + 1);
        List<Future<?>> tasks = new ArrayList<>();

        try {
            for (String id : ids) {
                tasks.add(pool.submit(() -> {
                    for (int i = 0; !stop.get(); i++) {
                        sut.put(id, filled(i, size));
                    }
                }));
                tasks.add(pool.submit(() -> {
                    while (!stop.get()) {
                        sut.get(id).ifPresent(a -> {
                            byte[] bytes = a.payload();
                            if (bytes.length != size || !uniform(bytes)) {
                                problems.add(id + " partial read, length=" + bytes.length);
                            }
                        });
                    }
                }));
            }
            tasks.add(pool.submit(() -> {
                while (!stop.get()) {
                    clock.advance(ttl.dividedBy(2));
                    sut.sweep(ttl);
                }
            }));

            Thread.sleep(500);
            stop.set(true);
            for (Future<?> task : tasks) {
                task.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(problems).isEmpty();

        // 직후의 sweep 은 방금 쓴 결과를 지우지 않는다
        for (String id : ids) {
            sut.put(id, filled(7, size));
        }
        sut.sweep(ttl);
        for (String id : ids) {
            assertThat(sut.get(id)).get()
                    .extracting(ResultArtifact::payload)
                    .isEqualTo(filled(7, size));
        }
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).noneMatch(f -> f.getFileName().toString().endsWith(".part"));
        }
    }

    private static byte[] filled(int value, int size) {
        byte[] bytes = new byte[size];
        Arrays.fill(bytes, (byte) value);
        return bytes;
    }

    private static boolean uniform(byte[] bytes) {
        for (byte b : bytes) {
            if (b != bytes[0]) return false;
        }
        return true;
    }
}
