package com.yerin.stylizer.storage;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.ResultArtifact;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 결과 이미지를 {@code <dir>/<jobId>.png} 로 보관한다.
 *
 * <p>쓰기는 같은 디렉터리의 임시 파일에 쓴 뒤 원자적으로 이동하므로 읽는 쪽은
 * 완성된 파일만 본다. 생성 시각은 서비스 Clock 으로 파일 수정 시각에 기록한다.
 * 같은 작업 ID 의 쓰기/삭제는 stripe 락으로 직렬화된다.
 */
@Slf4j
@Component
public class FileSystemResultStore implements ResultStore {

    private static final String SUFFIX = ".png";
    private static final String TEMP_SUFFIX = ".part";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final int STRIPES = 64;

    private final Path root;
    private final Duration ttl;
    private final Clock clock;
    private final Object[] stripes = new Object[STRIPES];

    @Autowired
    public FileSystemResultStore(JobqProperties properties, Clock clock) {
        this(Path.of(properties.getResult().getDir()), properties.getResult().getTtl(), clock);
    }

    public FileSystemResultStore(Path root, Duration ttl, Clock clock) {
        this.root = root.toAbsolutePath();
        this.ttl = ttl;
        this.clock = clock;
        for (int i = 0; i < STRIPES; i++) {
            stripes[i] = new Object();
        }
    }

    @Override
    public String put(String jobId, byte[] payload) {
        Path target = pathOf(jobId);
        synchronized (stripeOf(jobId)) {
            Path tmp = null;
            try {
                Files.createDirectories(root);
                tmp = Files.createTempFile(root, "." + jobId + "-", TEMP_SUFFIX);
                Files.write(tmp, payload);
                Files.setLastModifiedTime(tmp, FileTime.from(clock.instant()));
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                tmp = null;
            } catch (IOException e) {
                throw new ResultStoreException("failed to write result for job " + jobId, e);
            } finally {
                deleteQuietly(tmp);
            }
        }
        log.debug("[ResultStore] put jobId={}, bytes={}, path={}", jobId, payload.length, target);
        return target.toString();
    }

    @Override
    public Optional<ResultArtifact> get(String jobId) {
        Path file = pathOf(jobId);
        try {
            Instant createdAt = Files.getLastModifiedTime(file).toInstant();
            if (isExpired(createdAt, ttl)) {
                return Optional.empty();
            }
            byte[] bytes = Files.readAllBytes(file);
            return Optional.of(new ResultArtifact(jobId, bytes, createdAt));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new ResultStoreException("failed to read result for job " + jobId, e);
        }
    }

    @Override
    public boolean delete(String jobId) {
        Path file = pathOf(jobId);
        synchronized (stripeOf(jobId)) {
            try {
                return Files.deleteIfExists(file);
            } catch (IOException e) {
                throw new ResultStoreException("failed to delete result for job " + jobId, e);
            }
        }
    }

    @Override
    public int sweep(Duration ttl) {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        int deleted = 0;
        try (DirectoryStream<Path> files = Files.newDirectoryStream(root, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String jobId = name.substring(0, name.length() - SUFFIX.length());
                if (!SAFE_ID.matcher(jobId).matches()) {
                    continue;
                }
                if (deleteIfExpired(jobId, file, ttl)) {
                    deleted++;
                }
            }
        } catch (IOException e) {
            throw new ResultStoreException("failed to list results in " + root, e);
        }
        sweepStaleTempFiles(ttl);
        return deleted;
    }

    // put 이 중간에 죽으면 임시 파일이 남는다. 진행 중인 put 은 같은 stripe 락을 쥐고 있으므로 건드리지 않는다
    private void sweepStaleTempFiles(Duration ttl) {
        try (DirectoryStream<Path> files = Files.newDirectoryStream(root, ".*" + TEMP_SUFFIX)) {
            for (Path file : files) {
                String jobId = jobIdOfTemp(file.getFileName().toString());
                if (jobId == null) {
                    continue;
                }
                synchronized (stripeOf(jobId)) {
                    try {
                        if (isExpired(Files.getLastModifiedTime(file).toInstant(), ttl) && Files.deleteIfExists(file)) {
                            log.info("[ResultStore] removed stale temp file={}", file);
                        }
                    } catch (NoSuchFileException e) {
                        log.debug("[ResultStore] temp file already gone file={}", file);
                    } catch (IOException e) {
                        log.warn("[ResultStore] temp sweep skip file={}, err={}", file, e.toString());
                    }
                }
            }
        } catch (IOException e) {
            throw new ResultStoreException("failed to list temp files in " + root, e);
        }
    }

    /** {@code .<jobId>-<random>.part} 에서 jobId 를 꺼낸다. */
    static String jobIdOfTemp(String name) {
        int dash = name.lastIndexOf('-');
        if (!name.startsWith(".") || !name.endsWith(TEMP_SUFFIX) || dash <= 1) {
            return null;
        }
        String jobId = name.substring(1, dash);
        return SAFE_ID.matcher(jobId).matches() ? jobId : null;
    }

    private boolean deleteIfExpired(String jobId, Path file, Duration ttl) {
        // put 과 겹치면 교체된 파일의 시각으로 다시 판단한다
        synchronized (stripeOf(jobId)) {
            try {
                Instant createdAt = Files.getLastModifiedTime(file).toInstant();
                if (!isExpired(createdAt, ttl)) {
                    return false;
                }
                return Files.deleteIfExists(file);
            } catch (NoSuchFileException e) {
                return false;
            } catch (IOException e) {
                log.warn("[ResultStore] sweep skip file={}, err={}", file, e.toString());
                return false;
            }
        }
    }

    private boolean isExpired(Instant createdAt, Duration ttl) {
        return Duration.between(createdAt, clock.instant()).compareTo(ttl) > 0;
    }

    private Path pathOf(String jobId) {
        if (jobId == null || !SAFE_ID.matcher(jobId).matches()) {
            throw new IllegalArgumentException("invalid job id: " + jobId);
        }
        return root.resolve(jobId + SUFFIX);
    }

    private Object stripeOf(String jobId) {
        return stripes[Math.floorMod(jobId.hashCode(), STRIPES)];
    }

    private void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("[ResultStore] temp file cleanup failed path={}, err={}", tmp, e.toString());
        }
    }
}
