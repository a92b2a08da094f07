package glow.navigator.io;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.StringJoiner;

import picocli.CommandLine;

import glow.navigator.config.ArtifactType;
import glow.navigator.config.Settings;
import glow.navigator.model.Attr;

/**
 * Terminal rendering of node and edge data. Only the display fields of the
 * data's type are printed, coloured with the type's colour.
 */
public final class ConsoleFormatter {

    public static final String DEFAULT_COLOUR = "white";

    private static final Set<String> COLOURS = Set.of(
            "black", "red", "green", "yellow", "blue", "magenta", "cyan", "white");

    private final Settings settings;
    private final CommandLine.Help.Ansi ansi;

    public ConsoleFormatter(Settings settings) {
        this(settings, CommandLine.Help.Ansi.AUTO);
    }

    public ConsoleFormatter(Settings settings, CommandLine.Help.Ansi ansi) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.ansi = Objects.requireNonNull(ansi, "ansi");
    }

    public String format(Map<String, Object> data) {
        return format(data, null);
    }

    /**
     * @param colour colour to use instead of the type's, or null
     */
    public String format(Map<String, Object> data, String colour) {
        final String text = plain(data);
        final String c = colour != null ? colour : colourOf(data);
        if (text.isEmpty() || !ansi.enabled()) {
            return text;
        }
        // values never pass through picocli's @|...|@ markup
        final CommandLine.Help.Ansi.IStyle style = CommandLine.Help.Ansi.Style.fg(safeColour(c));
        return CommandLine.Help.Ansi.Style.on(style) + text + CommandLine.Help.Ansi.Style.off(style);
    }

    /**
     * Display fields as {@code k: v}, in settings order. Data of an unknown
     * type prints every field.
     */
    public String plain(Map<String, Object> data) {
        final StringJoiner joiner = new StringJoiner(", ");
        final Optional<ArtifactType> type = typeOf(data);
        if (type.isPresent() && !type.get().display().isEmpty()) {
            for (String field : type.get().display()) {
                if (data.containsKey(field)) {
                    joiner.add(field + ": " + data.get(field));
                }
            }
        } else {
            data.forEach((k, v) -> joiner.add(k + ": " + v));
        }
        return joiner.toString();
    }

    public String colourOf(Map<String, Object> data) {
        return typeOf(data).map(ArtifactType::color).filter(Objects::nonNull).orElse(DEFAULT_COLOUR);
    }

    /**
     * Level number right-aligned, then two spaces per level.
     */
    public static String indent(String text, int level) {
        return String.format("%3d %s%s", level, "  ".repeat(Math.max(level, 0)), text);
    }

    private Optional<ArtifactType> typeOf(Map<String, Object> data) {
        final Object type = data.get(Attr.TYPE);
        return type == null ? Optional.empty() : settings.forKind(type.toString());
    }

    private static String safeColour(String colour) {
        return colour != null && COLOURS.contains(colour.trim()) ? colour.trim() : DEFAULT_COLOUR;
    }
}
