package vn.com.fecredit.graph.mapper.util;

import java.util.regex.Pattern;

/**
 * Identifier and string-literal rendering shared by schema and data statements.
 */
public final class IdentifierHelper {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private IdentifierHelper() {
    }

    public static boolean isSimpleIdentifier(String name) {
        return name != null && SIMPLE_IDENTIFIER.matcher(name).matches();
    }

    /**
     * Emits {@code name} bare when it is a simple identifier, otherwise back-tick quoted.
     */
    public static String quoteIdentifier(String name) {
        if (isSimpleIdentifier(name)) return name;
        String n = name == null ? "" : name;
        return "`" + n.replace("`", "\\`") + "`";
    }

    /**
     * Escapes backslash, double quote, newline, carriage return and tab.
     */
    public static String escapeString(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\': sb.append("\\\\"); break;
                case '"': sb.append("\\\""); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    public static String quoteString(String value) {
        return "\"" + escapeString(value) + "\"";
    }

    /**
     * Property name for a mapping entry that has none: {@code level.nowLevel} becomes
     * {@code level_nowLevel}, {@code /a/b} becomes {@code a_b}.
     */
    public static String deriveName(String jsonPath) {
        if (jsonPath == null) return "";
        String p = jsonPath.trim();
        while (p.startsWith("/") || p.startsWith("$") || p.startsWith(".")) {
            p = p.substring(1);
        }
        String name = p.replaceAll("[^A-Za-z0-9_]+", "_");
        name = name.replaceAll("^_+|_+$", "");
        if (!name.isEmpty() && Character.isDigit(name.charAt(0))) {
            name = "_" + name;
        }
        return name;
    }
}
