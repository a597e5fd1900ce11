package io.stencil.core.template;

import java.util.Objects;

/// Template text outside any placeholder, including malformed placeholder text.
public record Literal(String text, int start, int end) implements TemplateSegment {

    public Literal {
        Objects.requireNonNull(text, "text must not be null");
    }
}
