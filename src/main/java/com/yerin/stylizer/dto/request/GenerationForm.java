package com.yerin.stylizer.dto.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

/**
 * multipart 폼 필드. 비어 있는 값은 설정 기본값으로 채운다.
 */
public record GenerationForm(
        @Size(max = 2000)
        @Schema(description = "생성 프롬프트", example = "make it a watercolor painting")
        String prompt,

        @Min(64) @Max(4096)
        Integer width,

        @Min(64) @Max(4096)
        Integer height,

        @Min(1) @Max(200)
        Integer numInferenceSteps,

        @DecimalMin("0.0")
        Double guidanceScale,

        @DecimalMin("0.0")
        Double trueCfgScale,

        @Min(0) @Max(4294967295L)
        @Schema(description = "비우면 무작위 시드")
        Long seed,

        @Size(max = 2000)
        String prompt2,

        @Size(max = 2000)
        String negativePrompt,

        @Size(max = 2000)
        String negativePrompt2
) {}
