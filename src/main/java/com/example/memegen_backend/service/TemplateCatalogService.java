package com.example.memegen_backend.service;

import com.example.memegen_backend.config.RenderSettings;
import com.example.memegen_backend.exception.StorageException;
import com.example.memegen_backend.model.Template;
import com.example.memegen_backend.model.TemplateConfig;
import com.example.memegen_backend.service.Interfaces.StorageService;
import com.example.memegen_backend.service.Interfaces.TemplateService;
import com.example.memegen_backend.util.Fingerprints;
import com.example.memegen_backend.util.UrlUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Template catalog backed by the local template directory.
 * <p>
 * Layout: {@code templates/{id}/config.yml} plus {@code default.{ext}} and one image per extra
 * style. Custom templates live under {@code custom/{fingerprint}/} and are only usable once a
 * background has been seeded there; this service never downloads anything.
 */
@Service
public class TemplateCatalogService implements TemplateService {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplateCatalogService.class);
    private static final List<String> IMAGE_EXTENSIONS = List.of("png", "jpg", "webp", "gif");
    private static final String CONFIG_FILE = "config.yml";
    static final String ANIMATED_STYLE = "animated";
    static final String OVERLAYS_DIR = "overlays";

    private final StorageService storage;
    private final RenderSettings settings;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, Template> templates = new ConcurrentHashMap<>();
    private final Map<String, Template> customTemplates = new ConcurrentHashMap<>();

    public TemplateCatalogService(StorageService storage, RenderSettings settings) {
        this.storage = storage;
        this.settings = settings;
        reload();
    }

    /**
     * Re-reads the template directory. Requests in flight keep the handles they already hold.
     */
    public void reload() {
        Path root = storage.rootTemplates();
        Map<String, Template> loaded = new ConcurrentHashMap<>();
        try (Stream<Path> dirs = Files.list(root)) {
            dirs.filter(Files::isDirectory)
                    .map(dir -> dir.getFileName().toString())
                    .forEach(id -> loaded.put(id, loadTemplate(id, storage.resolveTemplate(id))));
        } catch (IOException e) {
            throw new StorageException("Cannot list template directory " + root, e);
        }
        templates.clear();
        templates.putAll(loaded);
        LOGGER.info("Template catalog loaded count={} root={}", templates.size(), root);
    }

    @Override
    public Optional<Template> findById(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(templates.get(id));
    }

    @Override
    public Template errorTemplate() {
        String errorId = settings.errorTemplateId();
        Template known = templates.get(errorId);
        if (known != null) {
            return known;
        }
        return templates.computeIfAbsent(errorId, id -> {
            LOGGER.warn("Error template '{}' missing from catalog; using a blank background", id);
            return new Template(id, "Error", null, List.of(), Set.of(), List.of(), null, null, null);
        });
    }

    @Override
    public Template createFromUrl(String url) {
        String key = Fingerprints.shortKey(url);
        Template cached = customTemplates.get(key);
        if (cached != null && cached.imageExists()) {
            return cached;
        }
        Template fresh = loadCustom(url, key);
        if (!fresh.imageExists()) {
            // unseeded URLs are never retained
            customTemplates.remove(key);
            return fresh;
        }
        // compute() keeps one shared handle per seeded URL under concurrent creation
        return customTemplates.compute(key, (k, existing) ->
                existing != null && existing.imageExists() ? existing : fresh);
    }

    @Override
    public boolean hasImage(Template template) {
        return template != null && template.imageExists();
    }

    @Override
    public boolean supportsStyle(Template template, String style) {
        if (style == null || style.isBlank() || style.equals(settings.defaultStyle())) {
            return true;
        }
        if (template.getStyles().contains(style)) {
            return true;
        }
        if (ANIMATED_STYLE.equals(style)) {
            return template.isAnimated();
        }
        if (UrlUtils.schema(style)) {
            Optional<Path> overlay = findImage(storage.resolveCustom(OVERLAYS_DIR), Fingerprints.shortKey(style));
            if (overlay.isEmpty()) {
                LOGGER.error("Overlay not available for {} template: {}", template.getId(), style);
            }
            return overlay.isPresent();
        }
        LOGGER.error("Invalid style for {} template: {}", template.getId(), style);
        return false;
    }

    @Override
    public Collection<Template> all() {
        return templates.values().stream()
                .filter(t -> !t.getId().equals(settings.errorTemplateId()))
                .sorted(Comparator.comparing(Template::getId))
                .toList();
    }

    private Template loadTemplate(String id, Path dir) {
        TemplateConfig config = readConfig(dir);
        Set<String> styles = new LinkedHashSet<>(config.getStyles());
        styles.addAll(discoverStyles(dir));
        Path image = findImage(dir, "default").orElse(null);
        Path animated = dir.resolve("default.gif");
        if (Files.exists(animated)) {
            styles.add(ANIMATED_STYLE);
        }
        return new Template(id, config.getName(), config.getSource(), config.getKeywords(), styles,
                config.getExample(), dir, image, animated);
    }

    private Template loadCustom(String url, String key) {
        Path dir = storage.resolveCustom(key);
        Path image = findImage(dir, "default").orElse(dir.resolve("default.png"));
        LOGGER.debug("Custom template key={} url={} seeded={}", key, url, Files.exists(image));
        return new Template("custom-" + key, "Custom", url, List.of(), Set.of(), List.of(), dir, image,
                dir.resolve("default.gif"));
    }

    private TemplateConfig readConfig(Path dir) {
        Path file = dir.resolve(CONFIG_FILE);
        if (!Files.exists(file)) {
            return new TemplateConfig();
        }
        try {
            TemplateConfig config = yamlMapper.readValue(file.toFile(), TemplateConfig.class);
            return config == null ? new TemplateConfig() : config;
        } catch (IOException e) {
            throw new StorageException("Invalid template config: " + file, e);
        }
    }

    private List<String> discoverStyles(Path dir) {
        List<String> styles = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                    .filter(name -> name.contains("."))
                    .filter(name -> IMAGE_EXTENSIONS.contains(extensionOf(name)))
                    .map(name -> name.substring(0, name.lastIndexOf('.')))
                    .filter(base -> !base.equals("default"))
                    .distinct()
                    .forEach(styles::add);
        } catch (IOException e) {
            throw new StorageException("Cannot list template " + dir, e);
        }
        return styles;
    }

    private Optional<Path> findImage(Path dir, String baseName) {
        if (dir == null || !Files.isDirectory(dir)) {
            return Optional.empty();
        }
        for (String ext : IMAGE_EXTENSIONS) {
            Path candidate = dir.resolve(baseName + "." + ext);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static String extensionOf(String fileName) {
        return fileName.substring(fileName.lastIndexOf('.') + 1).toLowerCase(Locale.ROOT);
    }
}
