package com.yerin.stylizer.domain;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Generator 에 전달되는 생성 파라미터. 제출 이후에는 변경되지 않는다.
 */
@Builder(toBuilder = true)
public record GenerationParameters(
        String prompt,
        int width,
        int height,
        int numInferenceSteps,
        double guidanceScale,
        double trueCfgScale,
        long seed,
        String prompt2,
        String negativePrompt,
        String negativePrompt2,
        int maxSequenceLength,
        int numImagesPerPrompt,
        SourceImage image
) {
    public static final int MAX_SEQUENCE_LENGTH = 512;
    public static final int IMAGES_PER_PROMPT = 1;

    public GenerationParameters {
        Objects.requireNonNull(image, "image");
        if (prompt == null) prompt = "";
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("dimensions must be positive: " + width + "x" + height);
        }
        if (numInferenceSteps <= 0) {
            throw new IllegalArgumentException("numInferenceSteps must be positive: " + numInferenceSteps);
        }
    }

    /** 로그용 요약. 원본 이미지 바이트는 제외한다. */
    public Map<String, Object> toLogMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("prompt", prompt);
        m.put("width", width);
        m.put("height", height);
        m.put("steps", numInferenceSteps);
        m.put("guidanceScale", guidanceScale);
        m.put("trueCfgScale", trueCfgScale);
        m.put("seed", seed);
        if (prompt2 != null) m.put("prompt2", prompt2);
        if (negativePrompt != null) m.put("negativePrompt", negativePrompt);
        if (negativePrompt2 != null) m.put("negativePrompt2", negativePrompt2);
        m.put("imageBytes", image.size());
        return m;
    }
}
