package glow.navigator.scan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds module, template and workflow names quoted in the text of a
 * business test script. Each matcher's first group is the name.
 */
public final class FeatureScanner {

    private final Map<String, Pattern> matchers;

    public FeatureScanner(Map<String, String> matchers) {
        Objects.requireNonNull(matchers, "matchers");
        final Map<String, Pattern> compiled = new LinkedHashMap<>();
        matchers.forEach((kind, regex) -> compiled.put(kind, Pattern.compile(regex, Pattern.CASE_INSENSITIVE)));
        this.matchers = Collections.unmodifiableMap(compiled);
    }

    public Set<String> kinds() {
        return matchers.keySet();
    }

    /**
     * Distinct names in order of first appearance; unknown kinds match nothing.
     */
    public Set<String> matches(String kind, String content) {
        final Pattern pattern = matchers.get(kind);
        if (pattern == null || content == null) {
            return Set.of();
        }
        final Set<String> out = new LinkedHashSet<>();
        final Matcher m = pattern.matcher(content);
        while (m.find()) {
            final String name = m.groupCount() > 0 ? m.group(1) : m.group();
            if (name != null && !name.isBlank()) {
                out.add(name.trim());
            }
        }
        return out;
    }
}
