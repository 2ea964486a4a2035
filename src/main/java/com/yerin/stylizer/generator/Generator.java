package com.yerin.stylizer.generator;

import com.yerin.stylizer.domain.GenerationParameters;

/**
 * 이미지 생성 백엔드.
 *
 * <p>작업마다 독립적으로 여러 번 호출될 수 있어야 한다. 실패는
 * {@link GeneratorException} 으로 알리며, 메모리 부족처럼 자원이 고갈된 경우
 * {@link GeneratorException#isResourceExhausted()} 가 true 다.
 */
@FunctionalInterface
public interface Generator {

    /**
     * @return PNG 로 인코딩된 결과 이미지
     */
    byte[] generate(GenerationParameters parameters);
}
