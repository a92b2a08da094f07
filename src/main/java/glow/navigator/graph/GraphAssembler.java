package glow.navigator.graph;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import glow.navigator.config.ArtifactType;
import glow.navigator.config.Settings;
import glow.navigator.markup.NestedReference;
import glow.navigator.markup.Reference;
import glow.navigator.markup.ReferenceKind;
import glow.navigator.markup.SubDocument;
import glow.navigator.markup.SubDocumentException;
import glow.navigator.model.Attr;
import glow.navigator.model.Ids;
import glow.navigator.model.NodeKind;
import glow.navigator.record.RecordView;
import glow.navigator.scan.FeatureScanner;
import glow.navigator.scan.RawRecord;
import glow.navigator.scan.RecordSource;

/**
 * Builds the cross-reference graph from raw records.
 * Processing order matters:
 * 1) entities, metadata and indexes (property and command namespace)
 * 2) media (leaf nodes)
 * 3) conditions, formflows, templates, modules
 * 4) name references collected in 3, resolved against the lookup tables
 * 5) business tests, which only know names
 * One assembler builds one graph.
 */
public final class GraphAssembler {

    private static final Logger log = LoggerFactory.getLogger(GraphAssembler.class);

    static final List<String> ENTITY_PHASE = List.of("entity", "metadata", "index");
    static final List<String> MEDIA_PHASE = List.of("image", "sound");
    static final List<String> OBJECT_PHASE = List.of("condition", "formflow", "template", "module");
    static final List<String> TEST_PHASE = List.of("test");

    private static final Map<String, String> RULE_LINK_TYPES = Map.of(
            "CMD", "command",
            "PRP", "calculated property",
            "PRO", "defaulting rule",
            "VAL", "validation rule",
            "LOO", "lookup rule");

    private static final List<String[]> LIST_CONTAINERS = List.of(
            new String[]{"columns", "FieldName"},
            new String[]{"filters", "PropertyPath"},
            new String[]{"sortfields", "FieldName"});

    private final Settings settings;
    private final RecordSource source;

    private final Graph graph = new Graph("Glow");
    private final ReferenceTables tables = new ReferenceTables();
    private final ReferenceResolver resolver = new ReferenceResolver(tables);
    private final List<PendingReference> pending = new ArrayList<>();
    private int parseWarnings;
    private int unresolvedNames;
    private boolean built;

    public GraphAssembler(Settings settings, RecordSource source) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.source = Objects.requireNonNull(source, "source");
    }

    public AssemblyResult build() throws IOException {
        if (built) {
            throw new IllegalStateException("GraphAssembler already built its graph");
        }
        built = true;
        final int skippedBefore = source.skippedCount();

        load(ENTITY_PHASE);
        load(MEDIA_PHASE);
        load(OBJECT_PHASE);
        resolvePending();
        load(TEST_PHASE);
        parseWarnings += source.skippedCount() - skippedBefore;

        graph.freeze();
        tables.freeze();
        return new AssemblyResult(graph, tables, parseWarnings, unresolvedNames + resolver.misses());
    }

    private void load(List<String> typeNames) throws IOException {
        for (String typeName : typeNames) {
            final Optional<ArtifactType> type = settings.find(typeName);
            if (type.isEmpty()) {
                log.debug("No settings for {}, skipping", typeName);
                continue;
            }
            final List<RawRecord> records = source.enumerate(type.get());
            log.info("Loading {} records: {}", typeName, records.size());
            for (RawRecord record : records) {
                final int pendingBefore = pending.size();
                graph.begin();
                try {
                    dispatch(typeName, type.get(), record);
                    graph.commit();
                } catch (SubDocumentException | IllegalArgumentException | ClassCastException ex) {
                    // a record is linked completely or not at all
                    graph.rollback();
                    pending.subList(pendingBefore, pending.size()).clear();
                    parseWarnings++;
                    log.warn("Skipping {} record {}: {}", typeName, record.source(), ex.getMessage());
                }
            }
        }
    }

    private void dispatch(String typeName, ArtifactType type, RawRecord record) {
        switch (typeName) {
            case "entity":
                addEntity(type, record);
                break;
            case "metadata":
                addMetadata(type, record);
                break;
            case "index":
                addIndex(type, record);
                break;
            case "image":
            case "sound":
                addMedia(type, record);
                break;
            case "condition":
                addCondition(type, record);
                break;
            case "formflow":
                addFormflow(type, record);
                break;
            case "template":
                addTemplate(type, record);
                break;
            case "module":
                addModule(type, record);
                break;
            case "test":
                addTest(type, record);
                break;
            default:
                throw new IllegalArgumentException("No handler for artifact type " + typeName);
        }
    }

    // --- entity level ---

    private void addEntity(ArtifactType type, RawRecord record) {
        final String entity = Ids.baseName(record.source());
        final RecordView view = RecordView.of(type, record.values());
        graph.addNode(entity, entityAttributes(entity));

        final List<String> commands = new ArrayList<>();
        final Map<String, Object> properties = view.map("properties").orElse(Map.of());
        for (var e : properties.entrySet()) {
            final String name = e.getKey();
            final String key = Ids.memberKey(name, entity);
            if (!(e.getValue() instanceof List<?> rules)) {
                continue;
            }
            for (Object item : rules) {
                if (!(item instanceof Map<?, ?> rule)) {
                    continue;
                }
                final String ruleType = text(rule.get("ruleType"));
                final Map<String, Object> attrs = new LinkedHashMap<>();
                putIfPresent(attrs, "guid", rule.get("ruleId"));
                putIfPresent(attrs, "property_type", ruleType);
                putIfPresent(attrs, "rule_type", rule.get("methodName"));
                final List<String> conditions = strings(rule.get("conditionIds"));
                if (!conditions.isEmpty()) {
                    attrs.put("conditions", conditions);
                }
                attrs.put(Attr.NAME, name);
                attrs.put(Attr.ENTITY, entity);

                if ("CMD".equals(ruleType)) {
                    attrs.put(Attr.TYPE, NodeKind.COMMAND.label());
                    commands.add(name);
                } else {
                    attrs.put(Attr.TYPE, NodeKind.PROPERTY.label());
                }
                graph.addNode(key, attrs);

                final Map<String, Object> link = new LinkedHashMap<>(attrs);
                link.put(Attr.TYPE, Attr.LINK);
                link.put(Attr.LINK_TYPE, ruleLinkType(ruleType));
                graph.addEdge(entity, key, link);

                for (String condition : conditions) {
                    graph.addEdge(key, Ids.guid(condition), link);
                }
            }
        }
        commands.forEach(command -> resolver.recordCommand(command, entity));
    }

    private void addMetadata(ArtifactType type, RawRecord record) {
        final RecordView view = RecordView.of(type, record.values());
        final String entity = view.text(Attr.NAME).orElse(Ids.baseName(record.source()));
        graph.addNode(entity, entityAttributes(entity));

        final Optional<Map<String, Object>> data = view.map("data");
        if (data.isEmpty()) {
            return;
        }
        final RecordView meta = RecordView.nested(type, data.get());

        meta.map("read_only")
                .map(readOnly -> RecordView.nested(type, readOnly))
                .flatMap(readOnly -> readOnly.text("condition"))
                .ifPresent(condition -> graph.addEdge(entity, Ids.guid(condition),
                        link("read_only", "Entity metadata")));

        meta.text("icon").ifPresent(icon ->
                graph.addEdge(entity, Ids.guid(icon), link("icon_image", "Entity metadata")));

        final ArtifactType aggregateType = settings.require("aggregate");
        for (Object item : meta.list("aggregates")) {
            final RecordView aggregate = RecordView.nested(aggregateType, item);
            final Optional<String> name = aggregate.text(Attr.NAME);
            if (name.isEmpty()) {
                continue;
            }
            final String key = Ids.memberKey(name.get(), entity);
            final Map<String, Object> attrs = aggregate.attributes();
            attrs.put("property_type", "aggregate");
            attrs.put(Attr.ENTITY, entity);
            graph.addNode(key, attrs);
            graph.addEdge(entity, key, link("aggregate property", name.get()));

            aggregate.text("property").ifPresent(property ->
                    graph.addEdge(key, Ids.memberKey(Ids.bareProperty(property), entity),
                            link("aggregate source", property)));
            aggregate.text("condition").ifPresent(condition ->
                    graph.addEdge(key, Ids.guid(condition), link("aggregate condition", name.get())));
        }
    }

    private void addIndex(ArtifactType type, RawRecord record) {
        final RecordView view = RecordView.of(type, record.values());
        final String indexName = view.text(Attr.NAME).orElse(Ids.baseName(record.source()));
        final Optional<String> entity = view.text(Attr.ENTITY);
        final ArtifactType fieldType = settings.require("index_field");

        for (Object item : view.list("mappings")) {
            final RecordView field = RecordView.nested(fieldType, item);
            final Optional<String> fieldName = field.text(Attr.NAME);
            if (fieldName.isEmpty()) {
                continue;
            }
            final String key = fieldName.get().toLowerCase(Locale.ROOT);
            final Map<String, Object> attrs = field.attributes();
            attrs.put("index", indexName);
            entity.ifPresent(e -> attrs.put(Attr.ENTITY, e));
            graph.addNode(key, attrs);

            if (entity.isPresent()) {
                graph.addEdge(entity.get(), key, link("entity index", indexName));
                field.text("property").ifPresent(property ->
                        resolver.linkIfPresent(graph, key, property, entity.get(), link("index property", property)));
            }
        }
    }

    private void addMedia(ArtifactType type, RawRecord record) {
        final RecordView view = RecordView.of(type, record.values());
        final String guid = requireGuid(view);
        final Map<String, Object> attrs = view.attributes();
        if (view.text("media_type").filter("SND"::equalsIgnoreCase).isPresent()) {
            attrs.put(Attr.TYPE, NodeKind.SOUND.label());
        }
        graph.addNode(guid, attrs);
    }

    // --- objects referring to the entity namespace ---

    private void addCondition(ArtifactType type, RawRecord record) {
        final RecordView view = RecordView.of(type, record.values());
        final String key = Ids.fullGuid(Ids.baseName(record.source()));
        graph.addNode(key, view.attributes());

        final Optional<String> expression = view.text("expression");
        if (expression.isEmpty()) {
            return;
        }
        final String entity = view.text(Attr.ENTITY).orElse(null);
        for (Reference ref : SubDocument.parse(expression.get()).find("simpleConditionExpression")) {
            ref.get("property").ifPresent(property ->
                    resolver.linkIfPresent(graph, key, property, entity, ref.toEdgeAttributes()));
        }
    }

    private void addFormflow(ArtifactType type, RawRecord record) {
        final RecordView formflow = RecordView.of(type, record.values());
        final String guid = requireGuid(formflow);
        graph.addNode(guid, formflow.attributes());

        final String entity = formflow.text(Attr.ENTITY).orElse(null);
        if (entity != null) {
            graph.addEdge(entity, guid, link("formflow entity", null));
        }
        formflow.text("image").ifPresent(image ->
                graph.addEdge(guid, Ids.guid(image), link("formflow icon", null)));

        final ArtifactType conditionType = settings.require("formflow_condition");
        for (Object item : formflow.list("conditions")) {
            final RecordView condition = RecordView.nested(conditionType, item);
            condition.text("condition").ifPresent(target -> {
                final Map<String, Object> attrs = link("formflow condition", null);
                attrs.put("condition", Ids.guid(target));
                condition.guid().ifPresent(g -> attrs.put("guid", g));
                graph.addEdge(guid, Ids.guid(target), attrs);
            });
        }

        final ArtifactType taskType = settings.require("task");
        for (Object item : formflow.list("tasks")) {
            addTaskEdge(guid, entity, RecordView.nested(taskType, item));
        }

        // the embedded definition repeats some steps; both sources are linked
        final Optional<String> data = formflow.text("data");
        if (data.isPresent()) {
            addActivityEdges(guid, entity, SubDocument.parse(data.get()));
        }
        formflow.text(Attr.NAME).ifPresent(name -> tables.workflows().record(name, guid));
    }

    private void addTaskEdge(String formflow, String entity, RecordView task) {
        final String step = task.text("task").orElse("");
        final Map<String, Object> attrs = task.attributes();
        switch (step) {
            case "FRM":
                task.text("template").ifPresent(template -> {
                    attrs.put(Attr.LINK_TYPE, ReferenceKind.SHOW_FORM.linkType());
                    linkByKeyOrName(formflow, template, tables.templates(), attrs);
                });
                break;
            case "JMP":
                task.text("formflow").ifPresent(target -> {
                    attrs.put(Attr.LINK_TYPE, ReferenceKind.JUMP.linkType());
                    linkByKeyOrName(formflow, target, tables.workflows(), attrs);
                });
                break;
            case "RUN":
                task.text("command").ifPresent(command -> {
                    attrs.put(Attr.LINK_TYPE, ReferenceKind.RUN_COMMAND.linkType());
                    final String owner = task.text(Attr.ENTITY).orElse(entity);
                    graph.addEdge(formflow, resolver.commandKey(command, owner), attrs);
                });
                break;
            default:
                break;
        }
    }

    private void addActivityEdges(String formflow, String entity, SubDocument doc) {
        for (String tag : ReferenceKind.CONDITION.tags()) {
            for (Reference ref : doc.find(tag)) {
                ref.get("condition").ifPresent(condition ->
                        graph.addEdge(formflow, Ids.guid(condition), ref.toEdgeAttributes()));
            }
        }
        for (Reference ref : doc.find("ShowFormActivity")) {
            if (ref.has("template")) {
                graph.addEdge(formflow, Ids.guid(ref.get("template").get()), ref.toEdgeAttributes());
            } else {
                ref.get("template_name").ifPresent(name ->
                        defer(formflow, tables.templates(), name, ref.toEdgeAttributes()));
            }
        }
        for (Reference ref : doc.find("JumpActivity")) {
            if (ref.has("formflow")) {
                graph.addEdge(formflow, Ids.guid(ref.get("formflow").get()), ref.toEdgeAttributes());
            } else {
                ref.get("formflow_name").ifPresent(name ->
                        defer(formflow, tables.workflows(), name, ref.toEdgeAttributes()));
            }
        }
        for (Reference ref : doc.find("RunCommandActivity")) {
            ref.get("command").ifPresent(command -> {
                final String owner = ref.get(Attr.ENTITY).orElse(entity);
                graph.addEdge(formflow, resolver.commandKey(command, owner), ref.toEdgeAttributes());
            });
        }
        for (Reference ref : doc.find("PlaySoundActivity")) {
            ref.get("sound").ifPresent(sound ->
                    graph.addEdge(formflow, Ids.guid(sound), ref.toEdgeAttributes()));
        }
    }

    private void addTemplate(ArtifactType type, RawRecord record) {
        final RecordView template = RecordView.of(type, record.values());
        final String guid = requireGuid(template);
        graph.addNode(guid, template.attributes());

        final String entity = template.text(Attr.ENTITY).orElse(null);
        if (entity != null) {
            graph.addEdge(entity, guid, link("template entity", null));
        }

        final Optional<String> data = template.text("data");
        if (data.isPresent()) {
            final SubDocument doc = SubDocument.parse(data.get());
            for (Reference ref : doc.find("form")) {
                ref.get("image").ifPresent(image ->
                        graph.addEdge(guid, Ids.guid(image), ref.toEdgeAttributes("background image")));
            }
            for (Reference ref : doc.find("control")) {
                addControlEdges(guid, entity, ref);
            }
            addListEdges(guid, entity, doc);
        }

        final Optional<String> dependencies = template.text("dependencies");
        if (dependencies.isPresent()) {
            final SubDocument deps = SubDocument.parse(dependencies.get());
            for (var e : deps.findByAttribute("form", "templateID").entrySet()) {
                graph.addEdge(guid, Ids.guid(e.getKey()), e.getValue().toEdgeAttributes());
            }
            for (Reference ref : deps.find("workflow")) {
                ref.get("formflow").ifPresent(target ->
                        graph.addEdge(guid, Ids.guid(target), ref.toEdgeAttributes()));
            }
            for (Reference ref : deps.find("calculatedProperty")) {
                ref.get("property").ifPresent(property ->
                        resolver.linkIfPresent(graph, guid, property, entity, ref.toEdgeAttributes()));
            }
        }
        template.text(Attr.NAME).ifPresent(name -> tables.templates().record(name, guid));
    }

    private void addControlEdges(String template, String entity, Reference control) {
        final String subtype = control.get("control_type").orElse("");
        if ("SIM".equals(subtype)) {
            control.get("image").ifPresent(image ->
                    graph.addEdge(template, Ids.guid(image), control.toEdgeAttributes("static image")));
            return;
        }

        final Map<String, Object> attrs = control.toEdgeAttributes("TIL".equals(subtype) ? "tile" : "control");
        if (entity != null) {
            attrs.putIfAbsent(Attr.ENTITY, entity);
        }
        if (control.has("template")) {
            graph.addEdge(template, Ids.guid(control.get("template").get()), attrs);
        } else {
            control.get("template_name").ifPresent(name -> defer(template, tables.templates(), name, attrs));
        }
        control.get("formflow").ifPresent(target -> graph.addEdge(template, Ids.guid(target), attrs));
        control.get("command").ifPresent(command ->
                graph.addEdge(template, resolver.commandKey(command, entity), attrs));
        control.get("image").ifPresent(image -> graph.addEdge(template, Ids.guid(image), attrs));
        control.get("property").ifPresent(property ->
                resolver.resolvePropertyEdge(graph, template, property, entity,
                        control.toEdgeAttributes("bound property")));
    }

    private void addListEdges(String template, String entity, SubDocument doc) {
        for (String[] container : LIST_CONTAINERS) {
            for (NestedReference column : doc.findNested(container[0], container[1])) {
                final Map<String, Object> attrs = new LinkedHashMap<>();
                attrs.put(Attr.NAME, column.value());
                if (column.listType() != null) {
                    attrs.put("list_type", column.listType());
                }
                attrs.put("list_field", container[0]);
                attrs.put(Attr.TYPE, Attr.LINK);
                if (column.isGlobal()) {
                    attrs.put(Attr.LINK_TYPE, "global list column");
                    graph.addEdge(template, column.value().toLowerCase(Locale.ROOT), attrs);
                } else {
                    attrs.put(Attr.LINK_TYPE, "bound property");
                    resolver.resolvePropertyEdge(graph, template, column.value(), entity, attrs);
                }
            }
        }
    }

    private void addModule(ArtifactType type, RawRecord record) {
        final RecordView module = RecordView.of(type, record.values());
        final String guid = requireGuid(module);
        graph.addNode(guid, module.attributes());

        module.text("template").ifPresent(template -> {
            final Map<String, Object> attrs = link("module", "Landing Page");
            attrs.put("template", template);
            graph.addEdge(guid, Ids.guid(template), attrs);
        });
        module.text("code").ifPresent(code -> tables.modules().record(code, guid));
        module.text(Attr.NAME).ifPresent(name -> tables.modules().record(name, guid));
    }

    // --- free text ---

    private void addTest(ArtifactType type, RawRecord record) {
        final RecordView test = RecordView.of(type, record.values());
        final String name = test.text(Attr.NAME).orElse(Ids.baseName(record.source()));
        final String key = Ids.testKey(name);
        graph.addNode(key, test.attributes());

        final String content = test.text("content").orElse("");
        final FeatureScanner scanner = new FeatureScanner(type.matchers());
        for (String kind : scanner.kinds()) {
            final LookupTable table = tables.forMatcher(kind);
            for (String matched : scanner.matches(kind, content)) {
                final Map<String, Object> attrs = link("business test reference", matched);
                attrs.put("matcher", kind);
                graph.addEdge(key, table.first(matched).orElse(matched), attrs);
            }
        }
    }

    // --- deferred name references ---

    private void linkByKeyOrName(String from, String target, LookupTable table, Map<String, Object> attrs) {
        if (Ids.looksLikeGuid(target)) {
            graph.addEdge(from, Ids.guid(target), attrs);
        } else {
            defer(from, table, target, attrs);
        }
    }

    private void defer(String from, LookupTable table, String name, Map<String, Object> attrs) {
        pending.add(new PendingReference(from, table, name, new LinkedHashMap<>(attrs)));
    }

    private void resolvePending() {
        for (PendingReference ref : pending) {
            final Optional<String> key = ref.table().first(ref.name());
            if (key.isPresent()) {
                log.debug("Resolved {} '{}' to {}", ref.table().name(), ref.name(), key.get());
                graph.addEdge(ref.from(), key.get(), ref.attributes());
            } else {
                unresolvedNames++;
                log.debug("Unresolved {} '{}' referenced from {}", ref.table().name(), ref.name(), ref.from());
                graph.addEdge(ref.from(), Ids.unresolvedKey(ref.name()), ref.attributes());
            }
        }
        pending.clear();
    }

    private record PendingReference(String from, LookupTable table, String name, Map<String, Object> attributes) {
    }

    // --- helpers ---

    private static String requireGuid(RecordView view) {
        return view.guid().orElseThrow(() ->
                new IllegalArgumentException("record has no " + view.type().rawField("guid")));
    }

    private static Map<String, Object> entityAttributes(String entity) {
        final Map<String, Object> attrs = new LinkedHashMap<>();
        attrs.put(Attr.NAME, entity);
        attrs.put(Attr.TYPE, NodeKind.ENTITY.label());
        attrs.put(Attr.ENTITY, entity);
        return attrs;
    }

    private static Map<String, Object> link(String linkType, String name) {
        final Map<String, Object> attrs = new LinkedHashMap<>();
        if (name != null) {
            attrs.put(Attr.NAME, name);
        }
        attrs.put(Attr.TYPE, Attr.LINK);
        attrs.put(Attr.LINK_TYPE, linkType);
        return attrs;
    }

    private static String ruleLinkType(String ruleType) {
        final String known = ruleType == null ? null : RULE_LINK_TYPES.get(ruleType);
        return known != null ? known : "unknown->" + ruleType;
    }

    private static void putIfPresent(Map<String, Object> attrs, String key, Object value) {
        if (value != null) {
            attrs.put(key, value);
        }
    }

    private static String text(Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> strings(Object value) {
        final List<String> out = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object item : list) {
                if (item != null && !item.toString().isBlank()) {
                    out.add(item.toString());
                }
            }
        } else if (value != null && !value.toString().isBlank()) {
            out.add(value.toString());
        }
        return out;
    }
}
