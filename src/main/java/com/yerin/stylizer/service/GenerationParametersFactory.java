package com.yerin.stylizer.service;

import com.yerin.stylizer.config.JobqProperties;
import com.yerin.stylizer.domain.GenerationParameters;
import com.yerin.stylizer.domain.SourceImage;
import com.yerin.stylizer.dto.request.GenerationForm;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

@Component
@RequiredArgsConstructor
public class GenerationParametersFactory {

    static final long MAX_SEED = 0xFFFF_FFFFL;

    private final JobqProperties properties;

    public GenerationParameters create(GenerationForm form, SourceImage image) {
        JobqProperties.Defaults d = properties.getDefaults();
        return GenerationParameters.builder()
                .prompt(form.prompt())
                .width(orDefault(form.width(), d.getWidth()))
                .height(orDefault(form.height(), d.getHeight()))
                .numInferenceSteps(orDefault(form.numInferenceSteps(), d.getSteps()))
                .guidanceScale(form.guidanceScale() != null ? form.guidanceScale() : d.getGuidanceScale())
                .trueCfgScale(form.trueCfgScale() != null ? form.trueCfgScale() : d.getTrueCfgScale())
                .seed(form.seed() != null ? form.seed() : ThreadLocalRandom.current().nextLong(MAX_SEED + 1))
                .prompt2(blankToNull(form.prompt2()))
                .negativePrompt(blankToNull(form.negativePrompt()))
                .negativePrompt2(blankToNull(form.negativePrompt2()))
                .maxSequenceLength(GenerationParameters.MAX_SEQUENCE_LENGTH)
                .numImagesPerPrompt(GenerationParameters.IMAGES_PER_PROMPT)
                .image(image)
                .build();
    }

    private static int orDefault(Integer value, int fallback) {
        return value != null ? value : fallback;
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
