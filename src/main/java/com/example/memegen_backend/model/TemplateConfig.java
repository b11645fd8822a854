package com.example.memegen_backend.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * On-disk description of a template, read from {@code templates/{id}/config.yml}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TemplateConfig {
    private String name;
    private String source;
    private List<String> keywords = new ArrayList<>();
    private List<String> styles = new ArrayList<>();
    private List<String> example = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords == null ? new ArrayList<>() : keywords;
    }

    public List<String> getStyles() {
        return styles;
    }

    public void setStyles(List<String> styles) {
        this.styles = styles == null ? new ArrayList<>() : styles;
    }

    public List<String> getExample() {
        return example;
    }

    public void setExample(List<String> example) {
        this.example = example == null ? new ArrayList<>() : example;
    }
}
