package com.daniel.feedarr.feed;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.web.util.HtmlUtils;

/*
 * Collects labeled paragraphs for an item <description>.
 * Every value is HTML-escaped (& < > " ') before it is embedded; labels are fixed text.
 */
final class HtmlDescription {

    private static final String ENCODING = "UTF-8";

    private final List<String> paragraphs = new ArrayList<>();

    static HtmlDescription create() {
        return new HtmlDescription();
    }

    HtmlDescription paragraph(String label, Optional<String> value) {
        value.ifPresent(text -> paragraph(label, text));
        return this;
    }

    HtmlDescription paragraph(String label, String value) {
        paragraphs.add("<p>" + label + ": " + HtmlUtils.htmlEscape(value, ENCODING) + "</p>");
        return this;
    }

    String render(String fallback) {
        return paragraphs.isEmpty() ? fallback : String.join("\n", paragraphs);
    }
}
