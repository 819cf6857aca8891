package com.phillippitts.djvuocr.domain.zone;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable node of a DjVu hidden text tree.
 *
 * <p>A zone is either a leaf carrying {@link #text()} or an inner node carrying child zones.
 * The root of a page's tree is a {@link ZoneType#PAGE} zone whose bounding box spans the page.
 *
 * <p>Rendering follows the djvused S-expression syntax:
 * <pre>
 * (page 0 0 2550 3300
 *  (line 100 3000 900 3050
 *   (word 100 3000 300 3050 "Hello")))
 * </pre>
 */
public final class TextZone {

    private final ZoneType type;
    private final BBox bbox;
    private final String text;
    private final List<TextZone> children;

    private TextZone(ZoneType type, BBox bbox, String text, List<TextZone> children) {
        this.type = Objects.requireNonNull(type, "type");
        this.bbox = Objects.requireNonNull(bbox, "bbox");
        this.text = text;
        this.children = List.copyOf(children);
    }

    public static TextZone leaf(ZoneType type, BBox bbox, String text) {
        return new TextZone(type, bbox, Objects.requireNonNull(text, "text"), List.of());
    }

    public static TextZone node(ZoneType type, BBox bbox, List<TextZone> children) {
        return new TextZone(type, bbox, null, Objects.requireNonNull(children, "children"));
    }

    public ZoneType type() {
        return type;
    }

    public BBox bbox() {
        return bbox;
    }

    /**
     * @return leaf text, or {@code null} for inner nodes
     */
    public String text() {
        return text;
    }

    public List<TextZone> children() {
        return children;
    }

    /**
     * Maps this page zone from the coordinates of the rendered (rotated) image back to
     * page coordinates.
     *
     * @param rotation page rotation in degrees (0, 90, 180 or 270)
     * @return the rotated tree, or {@code this} for rotation 0
     * @throws IllegalArgumentException if rotation is not a multiple of 90
     * @throws IllegalStateException if this is not a page zone
     */
    public TextZone rotate(int rotation) {
        if (rotation % 90 != 0) {
            throw new IllegalArgumentException("rotation must be a multiple of 90: " + rotation);
        }
        int normalized = ((rotation % 360) + 360) % 360;
        if (normalized == 0) {
            return this;
        }
        if (type != ZoneType.PAGE) {
            throw new IllegalStateException("only page zones can be rotated, got " + type);
        }
        int w = bbox.x1();
        int h = bbox.y1();
        UnaryOperator<BBox> xform = switch (normalized) {
            case 90 -> b -> BBox.ofCorners(b.y0(), w - b.x0(), b.y1(), w - b.x1());
            case 180 -> b -> BBox.ofCorners(w - b.x0(), h - b.y0(), w - b.x1(), h - b.y1());
            case 270 -> b -> BBox.ofCorners(h - b.y0(), b.x0(), h - b.y1(), b.x1());
            default -> throw new IllegalArgumentException("unsupported rotation: " + rotation);
        };
        return transform(xform);
    }

    private TextZone transform(UnaryOperator<BBox> xform) {
        List<TextZone> mapped = new ArrayList<>(children.size());
        for (TextZone child : children) {
            mapped.add(child.transform(xform));
        }
        return new TextZone(type, xform.apply(bbox), text, mapped);
    }

    /**
     * Renders this zone tree as a djvused S-expression.
     */
    public String toSexpr() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb, 0);
        return sb.toString();
    }

    private void appendTo(StringBuilder sb, int depth) {
        sb.append('(').append(type.keyword())
                .append(' ').append(bbox.x0())
                .append(' ').append(bbox.y0())
                .append(' ').append(bbox.x1())
                .append(' ').append(bbox.y1());
        if (text != null) {
            sb.append(' ');
            appendQuoted(sb, text);
        }
        for (TextZone child : children) {
            sb.append('\n').append(" ".repeat(depth + 1));
            child.appendTo(sb, depth + 1);
        }
        sb.append(')');
    }

    /**
     * Appends {@code s} as a double-quoted S-expression string literal.
     * Quotes and backslashes are escaped, other control characters use octal escapes.
     */
    static void appendQuoted(StringBuilder sb, String s) {
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char ch = s.charAt(i);
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (ch < 0x20 || ch == 0x7f) {
                        sb.append('\\').append(String.format("%03o", (int) ch));
                    } else {
                        sb.append(ch);
                    }
                }
            }
        }
        sb.append('"');
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TextZone other)) {
            return false;
        }
        return type == other.type && bbox.equals(other.bbox)
                && Objects.equals(text, other.text) && children.equals(other.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, bbox, text, children);
    }

    @Override
    public String toString() {
        return "TextZone[" + type.keyword() + " " + bbox + ", children=" + children.size()
                + (text == null ? "" : ", chars=" + text.length()) + "]";
    }
}
