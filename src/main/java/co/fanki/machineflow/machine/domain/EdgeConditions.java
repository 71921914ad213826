package co.fanki.machineflow.machine.domain;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts guard conditions from edge labels.
 *
 * <p>Recognized forms, keyword case-insensitive, condition case kept:</p>
 * <pre>
 *   when: "errorCount &gt; 0"
 *   unless: 'approved'        (becomes !(approved))
 *   if: ready == true; note
 * </pre>
 *
 * <p>Keywords are tried in the order {@code when}, {@code unless},
 * {@code if}. Each accepts a double-quoted, single-quoted or unquoted
 * condition; unquoted conditions end at a semicolon.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class EdgeConditions {

    private static final String[] KEYWORDS = {"when", "unless", "if"};

    private EdgeConditions() {
    }

    /**
     * Extracts the guard from a label.
     *
     * @param label the edge label, may be null
     * @return the condition, or null when the label carries none
     */
    public static String extract(final String label) {
        if (label == null || label.isBlank()) {
            return null;
        }
        for (final String keyword : KEYWORDS) {
            final String condition = find(keyword, label);
            if (condition != null) {
                return "unless".equals(keyword)
                        ? "!(" + condition + ")" : condition;
            }
        }
        return null;
    }

    private static String find(final String keyword, final String label) {
        final String[] forms = {
            keyword + ":\\s*\"([^\"]+)\"",
            keyword + ":\\s*'([^']+)'",
            keyword + ":\\s*([^;]+)"
        };
        for (final String form : forms) {
            final Matcher matcher = Pattern.compile(form,
                    Pattern.CASE_INSENSITIVE).matcher(label);
            if (matcher.find()) {
                final String condition = matcher.group(1).trim();
                if (!condition.isEmpty()) {
                    return condition;
                }
            }
        }
        return null;
    }

}
