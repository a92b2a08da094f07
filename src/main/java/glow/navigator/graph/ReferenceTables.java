package glow.navigator.graph;

/**
 * Lookup tables owned by one build. A rebuild creates a new set.
 */
public final class ReferenceTables {

    private final LookupTable commands = new LookupTable("commands");
    private final LookupTable workflows = new LookupTable("workflows");
    private final LookupTable templates = new LookupTable("templates");
    private final LookupTable modules = new LookupTable("modules");

    public LookupTable commands() {
        return commands;
    }

    public LookupTable workflows() {
        return workflows;
    }

    public LookupTable templates() {
        return templates;
    }

    public LookupTable modules() {
        return modules;
    }

    /**
     * Table for a free-text matcher kind (module, template, workflow).
     */
    public LookupTable forMatcher(String kind) {
        switch (kind) {
            case "module":
                return modules;
            case "template":
                return templates;
            case "workflow":
            case "formflow":
                return workflows;
            default:
                throw new IllegalArgumentException("No lookup table for matcher: " + kind);
        }
    }

    void freeze() {
        commands.freeze();
        workflows.freeze();
        templates.freeze();
        modules.freeze();
    }
}
