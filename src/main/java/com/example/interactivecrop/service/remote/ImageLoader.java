package com.example.interactivecrop.service.remote;

import com.example.interactivecrop.model.ImageRef;
import java.awt.image.BufferedImage;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

@Component
public class ImageLoader {

    private static final Logger log = LoggerFactory.getLogger(ImageLoader.class);

    private final ImageSource imageSource;
    private final TaskExecutor executor;

    public ImageLoader(ImageSource imageSource, TaskExecutor executor) {
        this.imageSource = imageSource;
        this.executor = executor;
    }

    public void load(ImageRef image, Consumer<BufferedImage> onLoaded) {
        executor.execute(() -> {
            try {
                onLoaded.accept(imageSource.fetch(image));
            } catch (RuntimeException ex) {
                log.error("Failed to load preview {}", image.filename(), ex);
            }
        });
    }
}
