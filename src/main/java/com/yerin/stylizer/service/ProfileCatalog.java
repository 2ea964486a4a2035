package com.yerin.stylizer.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yerin.stylizer.dto.response.StyleProfile;
import com.yerin.stylizer.global.exception.AppException;
import com.yerin.stylizer.global.exception.code.JobErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * 프론트엔드가 쓰는 스타일 프리셋 목록(static/profiles.json).
 */
@Slf4j
@Service
public class ProfileCatalog {

    static final String PROFILES_PATH = "static/profiles.json";

    private final ObjectMapper objectMapper;
    private final Resource source;

    @Autowired
    public ProfileCatalog(ObjectMapper objectMapper) {
        this(objectMapper, new ClassPathResource(PROFILES_PATH));
    }

    public ProfileCatalog(ObjectMapper objectMapper, Resource source) {
        this.objectMapper = objectMapper;
        this.source = source;
    }

    public List<StyleProfile> findAll() {
        if (!source.exists()) {
            throw new AppException(JobErrorCode.PROFILES_NOT_FOUND);
        }
        try (InputStream in = source.getInputStream()) {
            return objectMapper.readValue(in, new TypeReference<List<StyleProfile>>() {});
        } catch (IOException e) {
            log.error("[Profiles] failed to read {}", source, e);
            throw new UncheckedIOException("profiles file is not readable", e);
        }
    }
}
