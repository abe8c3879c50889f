package com.example.interactivecrop.service.remote;

import com.example.interactivecrop.config.CropProperties;
import com.example.interactivecrop.exception.ImageLoadException;
import com.example.interactivecrop.model.ImageRef;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Component
public class RemoteImageSource implements ImageSource {

    private final RestTemplate restTemplate;
    private final String viewPath;

    public RemoteImageSource(RestTemplate restTemplate, CropProperties properties) {
        this.restTemplate = restTemplate;
        this.viewPath = properties.remote().viewPath();
    }

    @Override
    public BufferedImage fetch(ImageRef image) {
        byte[] bytes;
        try {
            bytes = restTemplate.getForObject(
                    viewPath + "?filename={filename}&type={type}&subfolder={subfolder}",
                    byte[].class,
                    image.filename(),
                    valueOrEmpty(image.type()),
                    valueOrEmpty(image.subfolder()));
        } catch (RestClientException ex) {
            throw new ImageLoadException("Failed to download preview " + image.filename(), ex);
        }
        if (bytes == null || bytes.length == 0) {
            throw new ImageLoadException("Preview " + image.filename() + " is empty", null);
        }
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(bytes));
            if (decoded == null) {
                throw new ImageLoadException("Unsupported image format for preview " + image.filename(), null);
            }
            return decoded;
        } catch (IOException ex) {
            throw new ImageLoadException("Failed to decode preview " + image.filename(), ex);
        }
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }
}
