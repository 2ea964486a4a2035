package com.yerin.stylizer.controller;

import com.yerin.stylizer.domain.GenerationParameters;
import com.yerin.stylizer.domain.ResultArtifact;
import com.yerin.stylizer.domain.SourceImage;
import com.yerin.stylizer.dto.request.GenerationForm;
import com.yerin.stylizer.dto.response.JobStatusResponse;
import com.yerin.stylizer.dto.response.JobSubmissionResponse;
import com.yerin.stylizer.global.dto.DataResponse;
import com.yerin.stylizer.service.GenerationParametersFactory;
import com.yerin.stylizer.service.JobQueryService;
import com.yerin.stylizer.service.SubmitJobService;
import com.yerin.stylizer.web.ImageUploadValidator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequiredArgsConstructor
public class JobController {

    private final SubmitJobService submitJobService;
    private final JobQueryService jobQueryService;
    private final ImageUploadValidator imageUploadValidator;
    private final GenerationParametersFactory parametersFactory;

    @Operation(summary = "Submit an image generation job")
    @ApiResponse(responseCode = "202", description = "Accepted and queued")
    @ApiResponse(responseCode = "503", description = "Queue is full")
    @PostMapping(value = "/process-image", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<DataResponse<JobSubmissionResponse>> submit(
            @RequestPart("image") MultipartFile image,
            @Valid @ModelAttribute GenerationForm form
    ) {
        SourceImage source = imageUploadValidator.validate(image);
        GenerationParameters parameters = parametersFactory.create(form, source);

        String jobId = submitJobService.submit(parameters);
        return ResponseEntity.accepted().body(DataResponse.from(JobSubmissionResponse.accepted(jobId)));
    }

    @Operation(summary = "Get job status")
    @GetMapping("/status/{jobId}")
    public ResponseEntity<DataResponse<JobStatusResponse>> status(@PathVariable String jobId) {
        return ResponseEntity.ok(DataResponse.from(jobQueryService.getStatus(jobId)));
    }

    @Operation(summary = "Get job result")
    @ApiResponse(responseCode = "200", description = "The generated image")
    @ApiResponse(responseCode = "202", description = "Job is not yet complete")
    @ApiResponse(responseCode = "404", description = "Job ID not found")
    @ApiResponse(responseCode = "500", description = "Job failed or result is missing")
    @GetMapping("/result/{jobId}")
    public ResponseEntity<?> result(@PathVariable String jobId) {
        JobQueryService.ResultLookup lookup = jobQueryService.getResult(jobId);

        if (lookup.artifact().isPresent()) {
            ResultArtifact artifact = lookup.artifact().get();
            return ResponseEntity.ok()
                    .contentType(MediaType.IMAGE_PNG)
                    .contentLength(artifact.size())
                    .body(artifact.payload());
        }
        return ResponseEntity.accepted()
                .contentType(MediaType.APPLICATION_JSON)
                .body(DataResponse.of(
                        "Job is not yet complete. Current status: " + lookup.status().value(),
                        jobQueryService.getStatus(jobId)));
    }
}
