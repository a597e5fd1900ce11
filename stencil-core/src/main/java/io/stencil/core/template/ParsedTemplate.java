package io.stencil.core.template;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;

/// Ordered, restartable view of a template as {@link TemplateSegment}s.
///
/// Literal and placeholder segments alternate in template order, cover the whole
/// template and never overlap. Consecutive literal text is always merged into one
/// {@link Literal}; an empty template yields no segments.
///
/// @implNote Immutable. Each {@link #iterator()} holds its own matcher, so iterations
/// may run concurrently.
public final class ParsedTemplate implements Iterable<TemplateSegment> {

    private final String template;

    ParsedTemplate(String template) {
        this.template = template;
    }

    /// @return the source template, never null
    public String template() {
        return template;
    }

    @Override
    public Iterator<TemplateSegment> iterator() {
        return new SegmentIterator();
    }

    /// Collects the placeholders in template order.
    ///
    /// @return placeholders, never null (may be empty)
    public List<Placeholder> placeholders() {
        List<Placeholder> placeholders = new ArrayList<>();
        for (TemplateSegment segment : this) {
            if (segment instanceof Placeholder placeholder) {
                placeholders.add(placeholder);
            }
        }
        return placeholders;
    }

    private final class SegmentIterator implements Iterator<TemplateSegment> {

        private final Matcher matcher = PlaceholderParser.PLACEHOLDER_PATTERN.matcher(template);
        private int cursor;
        private boolean exhausted;
        private Placeholder pending;
        private TemplateSegment next;

        @Override
        public boolean hasNext() {
            if (next == null) {
                next = advance();
            }
            return next != null;
        }

        @Override
        public TemplateSegment next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            TemplateSegment segment = next;
            next = null;
            return segment;
        }

        private TemplateSegment advance() {
            if (pending != null) {
                Placeholder placeholder = pending;
                pending = null;
                cursor = placeholder.end();
                return placeholder;
            }
            if (exhausted) {
                return null;
            }

            if (matcher.find()) {
                Placeholder placeholder =
                        new Placeholder(
                                matcher.group(1),
                                matcher.group(2),
                                matcher.group(3),
                                matcher.start(),
                                matcher.end());
                if (placeholder.start() > cursor) {
                    pending = placeholder;
                    return literal(cursor, placeholder.start());
                }
                cursor = placeholder.end();
                return placeholder;
            }

            exhausted = true;
            if (cursor < template.length()) {
                return literal(cursor, template.length());
            }
            return null;
        }

        private Literal literal(int start, int end) {
            return new Literal(template.substring(start, end), start, end);
        }
    }
}
