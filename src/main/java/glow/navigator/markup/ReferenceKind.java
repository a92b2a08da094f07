package glow.navigator.markup;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed table of the embedded elements that carry references, and how each
 * one maps its attributes and Placeholder children onto descriptor topics.
 */
public enum ReferenceKind {

    CONDITION(List.of("ConditionalIfActivity", "WhileActivity", "TransitionActivity"),
            topics("ResKey", "guid", "DisplayName", "name", "SelectedCondition", "condition"),
            Map.of(), null, "conditional task"),

    SHOW_FORM(List.of("ShowFormActivity"),
            topics("ResKey", "guid", "DisplayName", "name", "FormPK", "template", "Form", "template_name"),
            Map.of(), null, "show form"),

    JUMP(List.of("JumpActivity"),
            topics("ResKey", "guid", "DisplayName", "name", "WorkflowPK", "formflow", "Workflow", "formflow_name"),
            Map.of(), null, "jump to workflow"),

    RUN_COMMAND(List.of("RunCommandActivity"),
            topics("ResKey", "guid", "DisplayName", "name", "CommandRule", "command", "DataContext", "entity"),
            Map.of(), null, "run command"),

    PLAY_SOUND(List.of("PlaySoundActivity"),
            topics("ResKey", "guid", "DisplayName", "name", "Sound", "sound"),
            Map.of(), null, "play sound"),

    CONTROL(List.of("control"),
            topics("type", "control_type"),
            topics("Text", "name",
                    "Description", "description",
                    "PagePK", "template",
                    "Page", "template_name",
                    "Workflow", "formflow",
                    "Image", "image",
                    "CommandRule", "command",
                    "Url", "url",
                    "PropertyPath", "property",
                    "ListType", "list_type"),
            "type", "control"),

    FORM(List.of("form"),
            topics("templateID", "template", "path", "property"),
            topics("BackgroundImagePk", "image"),
            null, "form dependency"),

    WORKFLOW_DEPENDENCY(List.of("workflow"),
            topics("workflowID", "formflow"),
            Map.of(), null, "workflow dependency"),

    PROPERTY(List.of("calculatedProperty", "simpleConditionExpression"),
            topics("path", "property", "propertypath", "property"),
            Map.of(), null, "property dependency");

    private static final Map<String, ReferenceKind> BY_TAG;

    static {
        final Map<String, ReferenceKind> byTag = new HashMap<>();
        for (ReferenceKind kind : values()) {
            for (String tag : kind.tags) {
                byTag.put(tag, kind);
            }
        }
        BY_TAG = Collections.unmodifiableMap(byTag);
    }

    private final List<String> tags;
    private final Map<String, String> attributeTopics;
    private final Map<String, String> placeholderTopics;
    private final String subtypeAttribute;
    private final String linkType;

    ReferenceKind(List<String> tags,
                  Map<String, String> attributeTopics,
                  Map<String, String> placeholderTopics,
                  String subtypeAttribute,
                  String linkType) {
        this.tags = tags;
        this.attributeTopics = attributeTopics;
        this.placeholderTopics = placeholderTopics;
        this.subtypeAttribute = subtypeAttribute;
        this.linkType = linkType;
    }

    public static Optional<ReferenceKind> forTag(String tag) {
        return Optional.ofNullable(BY_TAG.get(tag));
    }

    public List<String> tags() {
        return tags;
    }

    public Map<String, String> attributeTopics() {
        return attributeTopics;
    }

    public Map<String, String> placeholderTopics() {
        return placeholderTopics;
    }

    public String subtypeAttribute() {
        return subtypeAttribute;
    }

    public String linkType() {
        return linkType;
    }

    private static Map<String, String> topics(String... pairs) {
        final Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            out.put(pairs[i], pairs[i + 1]);
        }
        return Collections.unmodifiableMap(out);
    }
}
