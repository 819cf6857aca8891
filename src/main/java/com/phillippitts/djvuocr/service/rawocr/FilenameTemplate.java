package com.phillippitts.djvuocr.service.rawocr;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File naming scheme for saved raw OCR output.
 *
 * <p>Fields:
 * <ul>
 *   <li>{@code {page}} - 1-based page number</li>
 *   <li>{@code {id}} - page identifier</li>
 *   <li>{@code {id-ext}} - page identifier without its extension</li>
 *   <li>{@code {page+N}}, {@code {page-N}} - page number shifted by N</li>
 * </ul>
 * Integer fields accept a format spec, e.g. {@code {page:04d}}. Literal braces are written
 * as {@code {{} and {@code }}}.
 */
public final class FilenameTemplate {

    private static final Pattern OFFSET_FIELD = Pattern.compile("([a-z]+)([+-])(\\d+)");
    private static final Pattern FORMAT_SPEC = Pattern.compile("(0)?(\\d+)?([ds])?");

    private final String template;

    private FilenameTemplate(String template) {
        this.template = template;
    }

    /**
     * Parses and validates a template by expanding it once with dummy values.
     *
     * @throws IllegalArgumentException if the template is malformed or names an unknown field
     */
    public static FilenameTemplate parse(String template) {
        Objects.requireNonNull(template, "template");
        FilenameTemplate t = new FilenameTemplate(template);
        t.expand(0, "");
        return t;
    }

    public String template() {
        return template;
    }

    /**
     * Expands the template for one page.
     *
     * @param pageNumber 1-based page number
     * @param pageId page identifier
     * @return expanded file name prefix
     */
    public String expand(int pageNumber, String pageId) {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("page", pageNumber);
        values.put("id", pageId);
        values.put("id-ext", stripExtension(pageId));

        StringBuilder out = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char ch = template.charAt(i);
            if (ch == '{') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '{') {
                    out.append('{');
                    i += 2;
                    continue;
                }
                int close = template.indexOf('}', i);
                if (close < 0) {
                    throw new IllegalArgumentException("cannot parse filename template '" + template
                            + "': expected '}' before end of string");
                }
                out.append(render(template.substring(i + 1, close), values));
                i = close + 1;
            } else if (ch == '}') {
                if (i + 1 < template.length() && template.charAt(i + 1) == '}') {
                    out.append('}');
                    i += 2;
                    continue;
                }
                throw new IllegalArgumentException("cannot parse filename template '" + template
                        + "': single '}' encountered");
            } else {
                out.append(ch);
                i++;
            }
        }
        return out.toString();
    }

    private String render(String field, Map<String, Object> values) {
        String name = field;
        String spec = "";
        int colon = field.indexOf(':');
        if (colon >= 0) {
            name = field.substring(0, colon);
            spec = field.substring(colon + 1);
        }
        Object value = lookup(name, values);
        return format(value, spec);
    }

    private Object lookup(String name, Map<String, Object> values) {
        Object direct = values.get(name);
        if (direct != null) {
            return direct;
        }
        Matcher m = OFFSET_FIELD.matcher(name);
        if (m.matches() && values.get(m.group(1)) instanceof Integer base) {
            int offset = Integer.parseInt(m.group(3));
            return "+".equals(m.group(2)) ? base + offset : base - offset;
        }
        throw new IllegalArgumentException("cannot parse filename template '" + template
                + "': unknown field '" + name + "'");
    }

    private String format(Object value, String spec) {
        if (spec.isEmpty()) {
            return String.valueOf(value);
        }
        Matcher m = FORMAT_SPEC.matcher(spec);
        if (!m.matches()) {
            throw new IllegalArgumentException("cannot parse filename template '" + template
                    + "': invalid format spec '" + spec + "'");
        }
        boolean zeroPad = m.group(1) != null;
        int width = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        String conversion = m.group(3);
        if (value instanceof Integer number) {
            if ("s".equals(conversion)) {
                throw new IllegalArgumentException("cannot parse filename template '" + template
                        + "': format 's' not allowed for integer field");
            }
            if (width == 0) {
                return number.toString();
            }
            return String.format(zeroPad ? "%0" + width + "d" : "%" + width + "d", number);
        }
        if ("d".equals(conversion) || zeroPad) {
            throw new IllegalArgumentException("cannot parse filename template '" + template
                    + "': numeric format for text field");
        }
        return width == 0 ? value.toString() : String.format("%-" + width + "s", value);
    }

    private static String stripExtension(String id) {
        int slash = Math.max(id.lastIndexOf('/'), id.lastIndexOf('\\'));
        int dot = id.lastIndexOf('.');
        return dot > slash + 1 ? id.substring(0, dot) : id;
    }

    @Override
    public String toString() {
        return template;
    }
}
