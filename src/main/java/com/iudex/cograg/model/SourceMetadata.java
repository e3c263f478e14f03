package com.iudex.cograg.model;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Structured metadata of a retrieved chunk.
 *
 * @param documentType source label such as {@code jurisprudencia}, {@code lei}, {@code doutrina}; may be {@code null}
 * @param page         page number inside the source document, if known
 * @param title        document title, if known
 * @param attributes   any other backend-supplied fields
 */
public record SourceMetadata(String documentType, Integer page, String title, Map<String, Object> attributes) {
    public static final SourceMetadata EMPTY = new SourceMetadata(null, null, null, Map.of());

    public SourceMetadata {
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    /**
     * Builds metadata from a loosely typed backend map, reading the usual key spellings.
     */
    public static SourceMetadata fromMap(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Object type = firstPresent(raw, "document_type", "documentType", "source_type", "tipo");
        Object page = firstPresent(raw, "page", "pagina");
        Object title = firstPresent(raw, "title", "titulo");
        Integer pageNumber = null;
        if (page instanceof Number number) {
            pageNumber = number.intValue();
        } else if (page != null) {
            try {
                pageNumber = Integer.valueOf(page.toString().trim());
            } catch (NumberFormatException e) {
                pageNumber = null;
            }
        }
        Map<String, Object> attributes = new HashMap<>();
        raw.forEach((key, value) -> {
            if (value != null) {
                attributes.put(key, value);
            }
        });
        return new SourceMetadata(type != null ? type.toString() : null, pageNumber, title != null ? title.toString() : null, attributes);
    }

    public String normalizedType() {
        return this.documentType == null ? "" : this.documentType.toLowerCase(Locale.ROOT).trim();
    }

    private static Object firstPresent(Map<String, Object> raw, String... keys) {
        for (String key : keys) {
            Object value = raw.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
