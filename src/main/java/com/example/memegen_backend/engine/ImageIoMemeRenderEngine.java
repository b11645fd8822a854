package com.example.memegen_backend.engine;

import com.example.memegen_backend.dto.ImageSize;
import com.example.memegen_backend.engine.Interfaces.MemeRenderEngine;
import com.example.memegen_backend.model.Template;
import com.example.memegen_backend.service.Interfaces.StorageService;
import com.example.memegen_backend.util.Fingerprints;
import com.example.memegen_backend.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Encodes the template background at the requested size and format.
 * Overlay text is not drawn; output is cached by a fingerprint of every job field.
 */
@Component
public class ImageIoMemeRenderEngine implements MemeRenderEngine {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageIoMemeRenderEngine.class);
    static final int BLANK_SIZE = 600;

    private final StorageService storage;

    public ImageIoMemeRenderEngine(StorageService storage) {
        this.storage = storage;
    }

    @Override
    public Path render(Template template, List<String> lines, String watermark, String extension,
                       String style, ImageSize size) throws IOException {
        String format = writableFormat(extension);
        String outExtension = "jpeg".equals(format) ? "jpg" : format;
        String key = "images/" + template.getId() + "/" + fingerprint(template, lines, watermark, extension, style, size) + "." + outExtension;
        if (storage.existsInOut(key)) {
            LOGGER.debug("Render cache hit key={}", key);
            return storage.resolveOut(key);
        }

        BufferedImage source = loadBackground(template, style);
        BufferedImage scaled = scale(source, size, opaque(extension));

        Path tmp = Files.createTempFile("meme-", "." + outExtension);
        try {
            if (!ImageIO.write(scaled, format, tmp.toFile())) {
                throw new IOException("ImageIO could not encode " + format);
            }
            storage.uploadToOut(tmp, key);
        } finally {
            Files.deleteIfExists(tmp);
        }
        LOGGER.info("Rendered template={} style={} ext={} size={}x{} key={}",
                template.getId(), style, extension, size.width(), size.height(), key);
        return storage.resolveOut(key);
    }

    private BufferedImage loadBackground(Template template, String style) throws IOException {
        Path image = styleImage(template, style);
        if (image != null && Files.exists(image)) {
            BufferedImage read = ImageIO.read(image.toFile());
            if (read != null) {
                return read;
            }
            LOGGER.warn("Unreadable background {}; using blank canvas", image);
        }
        BufferedImage blank = new BufferedImage(BLANK_SIZE, BLANK_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = blank.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, BLANK_SIZE, BLANK_SIZE);
        } finally {
            g.dispose();
        }
        return blank;
    }

    private Path styleImage(Template template, String style) {
        if (template.getDirectory() == null || style == null || style.isBlank() || UrlUtils.schema(style)) {
            return template.getImage();
        }
        if ("animated".equals(style) && template.isAnimated()) {
            return template.getAnimatedImage();
        }
        for (String ext : List.of("png", "jpg", "webp", "gif")) {
            Path candidate = template.getDirectory().resolve(style + "." + ext);
            if (Files.exists(candidate)) {
                return candidate;
            }
        }
        return template.getImage();
    }

    private BufferedImage scale(BufferedImage source, ImageSize size, boolean opaque) {
        int width = source.getWidth();
        int height = source.getHeight();
        if (size.width() > 0 && size.height() > 0) {
            width = size.width();
            height = size.height();
        } else if (size.width() > 0) {
            height = Math.max(1, (int) Math.round((double) source.getHeight() * size.width() / source.getWidth()));
            width = size.width();
        } else if (size.height() > 0) {
            width = Math.max(1, (int) Math.round((double) source.getWidth() * size.height() / source.getHeight()));
            height = size.height();
        }

        BufferedImage out = new BufferedImage(width, height, opaque ? BufferedImage.TYPE_INT_RGB : BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = out.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            if (opaque) {
                g.setColor(Color.WHITE);
                g.fillRect(0, 0, width, height);
            }
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return out;
    }

    private static boolean opaque(String extension) {
        return "jpg".equals(extension) || "jpeg".equals(extension);
    }

    /** ImageIO format name for the extension, or PNG when the JDK has no writer for it (webp). */
    private static String writableFormat(String extension) {
        String ext = extension.toLowerCase(Locale.ROOT);
        String format = "jpg".equals(ext) ? "jpeg" : ext;
        if (ImageIO.getImageWritersByFormatName(format).hasNext()) {
            return format;
        }
        LOGGER.debug("No ImageIO writer for {}; encoding PNG", format);
        return "png";
    }

    private static String fingerprint(Template template, List<String> lines, String watermark, String extension,
                                      String style, ImageSize size) {
        return Fingerprints.shortKey(String.join("|",
                template.getId(),
                String.valueOf(style),
                String.join("\n", lines),
                String.valueOf(watermark),
                extension,
                size.width() + "x" + size.height()));
    }
}
