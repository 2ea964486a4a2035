package com.yerin.stylizer.dto.response;

import java.util.List;

public record StyleProfile(
        String id,
        String name,
        String preview,
        List<String> tags,
        String modelId,
        String lora,
        long seed,
        String prompt,
        String negativePrompt
) {
    public StyleProfile {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
