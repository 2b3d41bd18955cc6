package io.valueseditor.core.descriptor;

import java.util.regex.Pattern;

/**
 * Field path helpers. A field path is a dotted key sequence such as
 * {@code image.repository}; sequence elements carry a bracketed ordinal on the
 * parent key, as in {@code servers[0].port}.
 *
 * <p>
 * Thread-safe: stateless utility class.
 */
public final class FieldPaths {

    private static final Pattern ORDINAL = Pattern.compile("\\[\\d+\\]");
    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z])(?=[A-Z])");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private FieldPaths() {}

    /**
     * Removes every bracketed ordinal ({@code [<digits>]}) from the path, so
     * that all elements of a sequence share one descriptor key.
     *
     * <p>
     * Best-effort: a path with unbalanced brackets is returned unchanged.
     * Removal repeats until no ordinal remains, which makes the operation
     * idempotent even for nested brackets such as {@code a[1[0]]}.
     *
     * @param path the field path, may be null
     * @return the normalized path, or the input itself if null or malformed
     */
    public static String normalize(String path) {
        if (path == null || path.indexOf('[') < 0 || !isBalanced(path)) {
            return path;
        }
        String current = path;
        String next = ORDINAL.matcher(current).replaceAll("");
        while (!next.equals(current)) {
            current = next;
            next = ORDINAL.matcher(current).replaceAll("");
        }
        return current;
    }

    /**
     * Appends a mapping key to a parent path.
     *
     * @param parent the parent path, empty for the root
     * @param key    the child key
     * @return {@code key} at the root, otherwise {@code parent.key}
     */
    public static String child(String parent, String key) {
        return parent == null || parent.isEmpty() ? key : parent + "." + key;
    }

    /**
     * Addresses an element of the sequence at the given path.
     *
     * @return {@code path[index]}
     */
    public static String element(String path, int index) {
        return path + "[" + index + "]";
    }

    /**
     * Returns the last dotted segment of the path, with its ordinal suffix
     * stripped.
     */
    public static String lastSegment(String path) {
        if (path == null || path.isEmpty()) {
            return "";
        }
        String segment = path.substring(path.lastIndexOf('.') + 1);
        return ORDINAL.matcher(segment).replaceAll("");
    }

    /**
     * Derives a human-readable title from the last path segment: camel-case
     * humps and underscores become spaces, then every letter that follows a
     * non-letter is upper-cased and every other letter lower-cased.
     * {@code pullPolicy} becomes {@code Pull Policy}, {@code max-retries}
     * becomes {@code Max-Retries} and {@code http2port} becomes
     * {@code Http2Port}.
     *
     * @param path the field path
     * @return the derived title, empty for an empty path
     */
    public static String derivedTitle(String path) {
        String spaced = CAMEL_BOUNDARY.matcher(lastSegment(path)).replaceAll(" ").replace('_', ' ');
        String words = WHITESPACE.matcher(spaced.trim()).replaceAll(" ");
        StringBuilder title = new StringBuilder(words.length());
        boolean afterLetter = false;
        for (int i = 0; i < words.length(); i++) {
            char c = words.charAt(i);
            if (Character.isLetter(c)) {
                title.append(afterLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                afterLetter = true;
            } else {
                title.append(c);
                afterLetter = false;
            }
        }
        return title.toString();
    }

    private static boolean isBalanced(String path) {
        int depth = 0;
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']' && --depth < 0) {
                return false;
            }
        }
        return depth == 0;
    }
}
