package com.example.samifier.model;

import com.example.samifier.exception.TemplateParseException;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural form of an {@code Fn::Sub} template string.
 *
 * {@code ${Name}} and {@code ${Name.Attr}} become placeholders, {@code ${!Text}} stays an escaped
 * literal and everything else is plain text. Rendering the segments back yields the original string.
 */
@EqualsAndHashCode
public class SubTemplate {

    public enum SegmentKind { LITERAL, PLACEHOLDER, ESCAPED }

    @Data
    @AllArgsConstructor
    public static class Segment {
        private SegmentKind kind;
        /** Literal text, escaped text or the placeholder name */
        private String text;
        /** Attribute after the first dot of a placeholder, null otherwise */
        private String attribute;

        public boolean isPseudo() {
            return kind == SegmentKind.PLACEHOLDER && text.contains("::");
        }

        /**
         * True when the placeholder can name a logical ID (resource or parameter)
         */
        public boolean isReference() {
            return kind == SegmentKind.PLACEHOLDER && !text.isEmpty() && !isPseudo();
        }

        String render() {
            switch (kind) {
                case PLACEHOLDER:
                    return "${" + text + (attribute != null ? "." + attribute : "") + "}";
                case ESCAPED:
                    return "${!" + text + "}";
                default:
                    return text;
            }
        }
    }

    private final List<Segment> segments;

    private SubTemplate(List<Segment> segments) {
        this.segments = segments;
    }

    public static SubTemplate parse(String text) {
        List<Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            int start = text.indexOf("${", i);
            if (start < 0) {
                literal.append(text, i, text.length());
                break;
            }
            literal.append(text, i, start);
            int end = text.indexOf('}', start + 2);
            if (end < 0) {
                throw new TemplateParseException("Unclosed '${' in Fn::Sub template at offset " + start + ": " + text);
            }
            flush(literal, segments);
            String body = text.substring(start + 2, end);
            if (body.startsWith("!")) {
                segments.add(new Segment(SegmentKind.ESCAPED, body.substring(1), null));
            } else {
                int dot = body.indexOf('.');
                if (dot < 0) {
                    segments.add(new Segment(SegmentKind.PLACEHOLDER, body, null));
                } else {
                    segments.add(new Segment(SegmentKind.PLACEHOLDER, body.substring(0, dot), body.substring(dot + 1)));
                }
            }
            i = end + 1;
        }
        flush(literal, segments);
        return new SubTemplate(segments);
    }

    private static void flush(StringBuilder literal, List<Segment> segments) {
        if (literal.length() > 0) {
            segments.add(new Segment(SegmentKind.LITERAL, literal.toString(), null));
            literal.setLength(0);
        }
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public Segment segment(int index) {
        return segments.get(index);
    }

    /**
     * Indices of placeholders that may name a logical ID
     */
    public List<Integer> referenceIndices() {
        List<Integer> indices = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            if (segments.get(i).isReference()) {
                indices.add(i);
            }
        }
        return indices;
    }

    public void renamePlaceholder(int index, String newName) {
        segments.get(index).setText(newName);
    }

    /**
     * Replaces a placeholder with fixed text, used when the referenced resource is folded away
     */
    public void replaceWithLiteral(int index, String literal) {
        Segment segment = segments.get(index);
        segment.setKind(SegmentKind.LITERAL);
        segment.setText(literal);
        segment.setAttribute(null);
    }

    public String render() {
        StringBuilder out = new StringBuilder();
        for (Segment segment : segments) {
            out.append(segment.render());
        }
        return out.toString();
    }

    public SubTemplate copy() {
        List<Segment> copied = new ArrayList<>();
        for (Segment segment : segments) {
            copied.add(new Segment(segment.getKind(), segment.getText(), segment.getAttribute()));
        }
        return new SubTemplate(copied);
    }

    @Override
    public String toString() {
        return render();
    }
}
