package com.example.interactivecrop.service.remote;

import com.example.interactivecrop.exception.ImageLoadException;
import com.example.interactivecrop.model.ImageRef;
import java.awt.image.BufferedImage;

public interface ImageSource {

    BufferedImage fetch(ImageRef image) throws ImageLoadException;
}
