package com.dcruver.tanaimport.convert;

import java.util.regex.Pattern;

/**
 * Turns node names into titles that are safe as filenames and as link targets.
 */
public final class TitleSanitizer {

    static final String UNTITLED = "Untitled";

    private static final Pattern ILLEGAL = Pattern.compile("[/?<>\\\\:*|\"]");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x1f\\x80-\\x9f]");
    private static final Pattern RESERVED = Pattern.compile("^\\.+$");
    private static final Pattern WINDOWS_RESERVED =
        Pattern.compile("^(con|prn|aux|nul|com[0-9]|lpt[0-9])(\\..*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern WINDOWS_TRAILING = Pattern.compile("[. ]+$");
    private static final Pattern LEADING_DOT = Pattern.compile("^\\.");
    // Characters that break wiki links: [ ] # | ^
    private static final Pattern LINK_BREAKING = Pattern.compile("[\\[\\]#|^]");

    private TitleSanitizer() {
    }

    public static String sanitize(String name) {
        if (name == null) {
            return UNTITLED;
        }
        String sanitized = ILLEGAL.matcher(name).replaceAll("");
        sanitized = CONTROL.matcher(sanitized).replaceAll("");
        sanitized = RESERVED.matcher(sanitized).replaceAll("");
        sanitized = WINDOWS_TRAILING.matcher(sanitized).replaceAll("");
        sanitized = WINDOWS_RESERVED.matcher(sanitized).replaceAll("");
        sanitized = LEADING_DOT.matcher(sanitized).replaceAll("");
        sanitized = LINK_BREAKING.matcher(sanitized).replaceAll("").trim();
        return sanitized.isEmpty() ? UNTITLED : sanitized;
    }
}
