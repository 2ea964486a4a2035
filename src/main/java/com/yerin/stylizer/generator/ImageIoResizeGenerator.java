package com.yerin.stylizer.generator;

import com.yerin.stylizer.domain.GenerationParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * 모델 백엔드 없이 동작하는 기본 Generator. 원본 이미지를 요청 크기로 다시 그려 PNG 로 돌려준다.
 * 실제 모델 서버를 붙일 때는 다른 {@link Generator} 빈으로 교체한다.
 */
@Slf4j
@Component
@Profile("!test")
public class ImageIoResizeGenerator implements Generator {

    @Override
    public byte[] generate(GenerationParameters parameters) {
        log.info("[Generator] generating image with params={}", parameters.toLogMap());
        try {
            BufferedImage source = ImageIO.read(new ByteArrayInputStream(parameters.image().bytes()));
            if (source == null) {
                throw new GeneratorException("Cannot identify image file. The file may be corrupt or unsupported.");
            }
            BufferedImage out = resize(source, parameters.width(), parameters.height());
            if (Thread.currentThread().isInterrupted()) {
                throw new GeneratorException("Generation interrupted.");
            }
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            ImageIO.write(out, "png", buffer);
            return buffer.toByteArray();
        } catch (OutOfMemoryError e) {
            log.error("[Generator] out of memory for {}x{}", parameters.width(), parameters.height());
            throw GeneratorException.resourceExhausted("Processing failed due to insufficient memory.", e);
        } catch (IOException e) {
            throw new GeneratorException("An unexpected error occurred during image generation.", e);
        }
    }

    private BufferedImage resize(BufferedImage source, int width, int height) {
        BufferedImage out = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }
}
