package com.yerin.stylizer.web;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.SourceImage;
import com.yerin.stylizer.global.exception.AppException;
import com.yerin.stylizer.global.exception.code.JobErrorCode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

/**
 * 업로드 이미지 검증: 확장자, 빈 파일, 헤더 바이트(PNG/JPEG/WEBP).
 */
@Component
@RequiredArgsConstructor
public class ImageUploadValidator {

    private static final byte[] PNG = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n'};
    private static final byte[] JPEG = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final byte[] RIFF = {'R', 'I', 'F', 'F'};
    private static final byte[] WEBP = {'W', 'E', 'B', 'P'};

    private final JobqProperties properties;

    public SourceImage validate(MultipartFile file) {
        Set<String> allowed = properties.getUpload().getAllowedExtensions();
        String ext = extensionOf(file.getOriginalFilename());
        if (!allowed.contains(ext)) {
            throw new AppException(JobErrorCode.INVALID_IMAGE.withDetail(
                    "Invalid file type. Allowed extensions are: " + String.join(", ", allowed)));
        }
        if (file.isEmpty()) {
            throw new AppException(JobErrorCode.INVALID_IMAGE.withDetail("Uploaded file is empty."));
        }

        byte[] bytes;
        try {
            bytes = file.getBytes();
        } catch (IOException e) {
            throw new AppException(JobErrorCode.INVALID_IMAGE.withDetail(
                    "An error occurred while reading the image: " + e.getMessage()));
        }

        String contentType = sniff(bytes);
        if (contentType == null) {
            throw new AppException(JobErrorCode.INVALID_IMAGE.withDetail(
                    "Cannot identify image file. The file may be corrupt."));
        }
        return new SourceImage(file.getOriginalFilename(), contentType, bytes);
    }

    static String extensionOf(String filename) {
        if (filename == null) return "";
        int dot = filename.lastIndexOf('.');
        return dot < 0 ? "" : filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    static String sniff(byte[] b) {
        if (startsWith(b, 0, PNG)) return "image/png";
        if (startsWith(b, 0, JPEG)) return "image/jpeg";
        if (startsWith(b, 0, RIFF) && startsWith(b, 8, WEBP)) return "image/webp";
        return null;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (data.length < offset + prefix.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) return false;
        }
        return true;
    }
}
