package com.yerin.stylizer.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * 업로드된 원본 이미지. 바이트 배열은 생성/조회 시 복사한다.
 */
public record SourceImage(String filename, String contentType, byte[] bytes) {

    public SourceImage {
        Objects.requireNonNull(bytes, "bytes");
        bytes = bytes.clone();
    }

    @Override
    public byte[] bytes() {
        return bytes.clone();
    }

    public int size() {
        return bytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceImage other)) return false;
        return Objects.equals(filename, other.filename)
                && Objects.equals(contentType, other.contentType)
                && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(filename, contentType) + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return "SourceImage[filename=" + filename + ", contentType=" + contentType + ", size=" + bytes.length + "]";
    }
}
