package com.yerin.stylizer.controller;

import com.yerin.stylizer.dto.response.StyleProfile;
import com.yerin.stylizer.global.dto.DataResponse;
import com.yerin.stylizer.service.ProfileCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ProfileController {

    private final ProfileCatalog profileCatalog;

    @GetMapping("/profiles")
    public ResponseEntity<DataResponse<List<StyleProfile>>> profiles() {
        return ResponseEntity.ok(DataResponse.from(profileCatalog.findAll()));
    }
}
