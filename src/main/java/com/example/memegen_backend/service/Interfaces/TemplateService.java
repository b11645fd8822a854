package com.example.memegen_backend.service.Interfaces;

import com.example.memegen_backend.model.Template;

import java.util.Collection;
import java.util.Optional;

/**
 * Read-mostly namespace of templates. Implementations own their consistency for
 * concurrent custom-template creation.
 */
public interface TemplateService {

    Optional<Template> findById(String id);

    /** Template rendered whenever resolution fails; always available. */
    Template errorTemplate();

    /** Returns the (possibly cached) custom template for a background URL. */
    Template createFromUrl(String url);

    boolean hasImage(Template template);

    boolean supportsStyle(Template template, String style);

    Collection<Template> all();
}
