package com.example.memegen_backend.model;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A background image plus the styles it can be rendered in.
 * Instances are shared across requests and never mutated.
 */
public final class Template {
    private final String id;
    private final String name;
    private final String source;
    private final List<String> keywords;
    private final Set<String> styles;
    private final List<String> example;
    private final Path directory;
    private final Path image;
    private final Path animatedImage;

    public Template(String id, String name, String source, List<String> keywords, Set<String> styles,
                    List<String> example, Path directory, Path image, Path animatedImage) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.source = source;
        this.keywords = keywords == null ? List.of() : List.copyOf(keywords);
        this.styles = styles == null ? Set.of() : Set.copyOf(styles);
        this.example = example == null ? List.of() : List.copyOf(example);
        this.directory = directory;
        this.image = image;
        this.animatedImage = animatedImage;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getSource() {
        return source;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public Set<String> getStyles() {
        return styles;
    }

    public List<String> getExample() {
        return example;
    }

    public Path getDirectory() {
        return directory;
    }

    /** Default background, or {@code null} when none is known. */
    public Path getImage() {
        return image;
    }

    public Path getAnimatedImage() {
        return animatedImage;
    }

    public boolean imageExists() {
        return image != null && Files.exists(image);
    }

    public boolean isAnimated() {
        return animatedImage != null && Files.exists(animatedImage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Template that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Template{id='" + id + "', styles=" + styles + ", image=" + image + '}';
    }
}
