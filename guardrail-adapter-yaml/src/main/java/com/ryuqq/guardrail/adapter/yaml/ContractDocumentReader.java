package com.ryuqq.guardrail.adapter.yaml;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.guardrail.core.architecture.ArchitectureGraph;
import com.ryuqq.guardrail.core.architecture.ArchitectureValidator;
import com.ryuqq.guardrail.core.contract.ContractDefinition;
import com.ryuqq.guardrail.core.contract.GenericPredicateRule;
import com.ryuqq.guardrail.core.contract.LayerDependencyRule;
import com.ryuqq.guardrail.core.contract.Rule;
import com.ryuqq.guardrail.core.contract.Severity;
import com.ryuqq.guardrail.core.contract.StateTransitionRule;
import com.ryuqq.guardrail.core.model.ContractName;
import com.ryuqq.guardrail.core.model.EntityType;
import com.ryuqq.guardrail.core.model.PredicateName;
import com.ryuqq.guardrail.core.model.RuleId;
import com.ryuqq.guardrail.core.model.StateId;
import com.ryuqq.guardrail.core.statemachine.StateMachine;
import com.ryuqq.guardrail.core.statemachine.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.at;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.child;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.optionalText;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.require;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.requireArray;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.requireObject;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.requireText;
import static com.ryuqq.guardrail.adapter.yaml.DocumentNodes.text;

/**
 * Reads a YAML (or JSON) contract document into a {@link ContractDefinition}.
 *
 * <p>The reader only maps the document to the model. Semantic checks (reachability, unknown
 * predicates, undeclared layers) happen when the definition is published.</p>
 *
 * <p><strong>Document Format:</strong></p>
 * <pre>
 * contract: payments
 * rules:
 *   - id: payment-lifecycle
 *     type: state-transition        # state-transition | layer-dependency | generic
 *     severity: block               # block | warn (default block)
 *     description: Payment lifecycle
 *     entity: payment
 *     machine:
 *       states: [pending, paid, refunded]
 *       initial_state: pending
 *       terminal: [refunded]        # optional; default = states without outgoing edges
 *       transitions:
 *         pending: [paid]
 *         paid: [{to: refunded, guard: refund-window-open}]
 *   - id: layering
 *     type: layer-dependency
 *     architecture:
 *       modules: {api: web, db: data}
 *       allowed: {web: [data]}
 *       forbidden: [sqlalchemy]       # optional; no module may depend on these
 *       hints:
 *         "data->web": Move shared code to a lower layer
 *         "forbidden::sqlalchemy": Use the service layer to perform DB work
 *   - id: amount-positive
 *     type: generic
 *     predicate: amount-positive
 * </pre>
 *
 * <p>Instances are thread-safe.</p>
 *
 * @author Guardrail Team
 * @since 1.0.0
 */
public class ContractDocumentReader {

    private static final Logger log = LoggerFactory.getLogger(ContractDocumentReader.class);

    private final ObjectMapper mapper;

    /**
     * Creates a reader backed by a YAML-capable {@link ObjectMapper}.
     */
    public ContractDocumentReader() {
        this(DocumentNodes.newMapper());
    }

    /**
     * Creates a reader backed by the given mapper (e.g. a plain JSON mapper).
     *
     * @param mapper the Jackson mapper
     * @throws IllegalArgumentException if mapper is null
     */
    public ContractDocumentReader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * Reads a contract document from a file.
     *
     * @param path the document path
     * @return the unpublished definition
     * @throws ContractDocumentException if the document is malformed
     * @throws UncheckedIOException if the file cannot be read
     */
    public ContractDefinition read(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            ContractDefinition definition = read(reader);
            log.info("Loaded contract '{}' ({} rule(s)) from {}", definition.name(), definition.rules().size(), path);
            return definition;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read contract document " + path, e);
        }
    }

    /**
     * Reads a contract document from a string.
     *
     * @param content the document text
     * @return the unpublished definition
     * @throws ContractDocumentException if the document is malformed
     */
    public ContractDefinition readString(String content) {
        if (content == null) {
            throw new IllegalArgumentException("content cannot be null");
        }
        return read(new StringReader(content));
    }

    /**
     * Reads a contract document from a reader. The reader is not closed.
     *
     * @param reader the document source
     * @return the unpublished definition
     * @throws ContractDocumentException if the document is malformed
     * @throws UncheckedIOException if the reader fails
     */
    public ContractDefinition read(Reader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        JsonNode root = DocumentNodes.parse(mapper, reader);

        String name = requireText(root, "contract", "");
        ContractName contractName = at("/contract", () -> ContractName.of(name));

        String rulesPointer = "/rules";
        JsonNode rulesNode = requireArray(require(root, "rules", ""), rulesPointer);
        List<Rule> rules = new ArrayList<>();
        for (int i = 0; i < rulesNode.size(); i++) {
            rules.add(readRule(requireObject(rulesNode.get(i), child(rulesPointer, i)), child(rulesPointer, i)));
        }
        return new ContractDefinition(contractName, rules);
    }

    private Rule readRule(JsonNode node, String pointer) {
        String id = requireText(node, "id", pointer);
        RuleId ruleId = at(child(pointer, "id"), () -> RuleId.of(id));
        String type = requireText(node, "type", pointer).toLowerCase(Locale.ROOT);
        Severity severity = readSeverity(node, pointer);
        String description = optionalText(node, "description", pointer, id);

        return switch (type) {
            case "state-transition" -> {
                String entity = requireText(node, "entity", pointer);
                EntityType entityType = at(child(pointer, "entity"), () -> EntityType.of(entity));
                String machinePointer = child(pointer, "machine");
                StateMachine machine = readMachine(requireObject(require(node, "machine", pointer), machinePointer),
                    machinePointer);
                yield new StateTransitionRule(ruleId, severity, description, entityType, machine);
            }
            case "layer-dependency" -> {
                String graphPointer = child(pointer, "architecture");
                ArchitectureGraph graph = readGraph(
                    requireObject(require(node, "architecture", pointer), graphPointer), graphPointer);
                yield new LayerDependencyRule(ruleId, severity, description, graph);
            }
            case "generic" -> {
                String predicate = requireText(node, "predicate", pointer);
                PredicateName predicateName = at(child(pointer, "predicate"), () -> PredicateName.of(predicate));
                yield new GenericPredicateRule(ruleId, severity, description, predicateName);
            }
            default -> throw new ContractDocumentException(child(pointer, "type"),
                "unknown rule type '" + type + "' (expected state-transition, layer-dependency or generic)");
        };
    }

    private Severity readSeverity(JsonNode node, String pointer) {
        String value = optionalText(node, "severity", pointer, "block");
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "block" -> Severity.BLOCK;
            case "warn" -> Severity.WARN;
            default -> throw new ContractDocumentException(child(pointer, "severity"),
                "unknown severity '" + value + "' (expected block or warn)");
        };
    }

    private StateMachine readMachine(JsonNode node, String pointer) {
        String statesPointer = child(pointer, "states");
        JsonNode statesNode = requireArray(require(node, "states", pointer), statesPointer);
        Set<StateId> states = new LinkedHashSet<>();
        for (int i = 0; i < statesNode.size(); i++) {
            String statePointer = child(statesPointer, i);
            String value = text(statesNode.get(i), statePointer);
            states.add(at(statePointer, () -> StateId.of(value)));
        }

        String initialValue = requireText(node, "initial_state", pointer);
        StateId initial = at(child(pointer, "initial_state"), () -> StateId.of(initialValue));

        Set<Transition> transitions = new LinkedHashSet<>();
        JsonNode transitionsNode = node.get("transitions");
        if (transitionsNode != null && !transitionsNode.isNull()) {
            String transitionsPointer = child(pointer, "transitions");
            requireObject(transitionsNode, transitionsPointer);
            Iterator<Map.Entry<String, JsonNode>> fields = transitionsNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                String fromPointer = child(transitionsPointer, entry.getKey());
                StateId from = at(fromPointer, () -> StateId.of(entry.getKey()));
                readTargets(from, entry.getValue(), fromPointer, transitions);
            }
        }

        Set<StateId> terminal = new LinkedHashSet<>();
        JsonNode terminalNode = node.get("terminal");
        if (terminalNode != null && !terminalNode.isNull()) {
            String terminalPointer = child(pointer, "terminal");
            requireArray(terminalNode, terminalPointer);
            for (int i = 0; i < terminalNode.size(); i++) {
                String statePointer = child(terminalPointer, i);
                String value = text(terminalNode.get(i), statePointer);
                terminal.add(at(statePointer, () -> StateId.of(value)));
            }
        } else {
            Set<StateId> sources = new LinkedHashSet<>();
            for (Transition transition : transitions) {
                sources.add(transition.from());
            }
            for (StateId state : states) {
                if (!sources.contains(state)) {
                    terminal.add(state);
                }
            }
        }
        return at(pointer, () -> new StateMachine(states, transitions, initial, terminal));
    }

    private void readTargets(StateId from, JsonNode targets, String pointer, Set<Transition> transitions) {
        if (targets.isNull()) {
            return;
        }
        if (!targets.isArray()) {
            transitions.add(readTarget(from, targets, pointer));
            return;
        }
        for (int i = 0; i < targets.size(); i++) {
            transitions.add(readTarget(from, targets.get(i), child(pointer, i)));
        }
    }

    private Transition readTarget(StateId from, JsonNode target, String pointer) {
        if (target.isObject()) {
            String to = requireText(target, "to", pointer);
            StateId toState = at(child(pointer, "to"), () -> StateId.of(to));
            String guard = optionalText(target, "guard", pointer, null);
            if (guard == null) {
                return Transition.of(from, toState);
            }
            PredicateName guardName = at(child(pointer, "guard"), () -> PredicateName.of(guard));
            return Transition.guarded(from, toState, guardName);
        }
        String to = text(target, pointer);
        return Transition.of(from, at(pointer, () -> StateId.of(to)));
    }

    private ArchitectureGraph readGraph(JsonNode node, String pointer) {
        ArchitectureGraph.Builder builder = ArchitectureGraph.builder();

        String modulesPointer = child(pointer, "modules");
        JsonNode modules = requireObject(require(node, "modules", pointer), modulesPointer);
        Iterator<Map.Entry<String, JsonNode>> moduleFields = modules.fields();
        while (moduleFields.hasNext()) {
            Map.Entry<String, JsonNode> entry = moduleFields.next();
            String modulePointer = child(modulesPointer, entry.getKey());
            if (entry.getValue().isNull()) {
                at(modulePointer, () -> builder.declare(entry.getKey()));
            } else {
                String layer = text(entry.getValue(), modulePointer);
                at(modulePointer, () -> builder.module(entry.getKey(), layer));
            }
        }

        JsonNode allowed = node.get("allowed");
        if (allowed != null && !allowed.isNull()) {
            String allowedPointer = child(pointer, "allowed");
            requireObject(allowed, allowedPointer);
            Iterator<Map.Entry<String, JsonNode>> allowedFields = allowed.fields();
            while (allowedFields.hasNext()) {
                Map.Entry<String, JsonNode> entry = allowedFields.next();
                String fromPointer = child(allowedPointer, entry.getKey());
                JsonNode targets = entry.getValue();
                if (targets.isNull()) {
                    continue;
                }
                requireArray(targets, fromPointer);
                for (int i = 0; i < targets.size(); i++) {
                    String targetPointer = child(fromPointer, i);
                    String to = text(targets.get(i), targetPointer);
                    at(targetPointer, () -> builder.allow(entry.getKey(), to));
                }
            }
        }

        JsonNode forbidden = node.get("forbidden");
        if (forbidden != null && !forbidden.isNull()) {
            String forbiddenPointer = child(pointer, "forbidden");
            requireArray(forbidden, forbiddenPointer);
            for (int i = 0; i < forbidden.size(); i++) {
                String modulePointer = child(forbiddenPointer, i);
                String module = text(forbidden.get(i), modulePointer);
                at(modulePointer, () -> builder.forbid(module));
            }
        }

        JsonNode hints = node.get("hints");
        if (hints != null && !hints.isNull()) {
            String hintsPointer = child(pointer, "hints");
            requireObject(hints, hintsPointer);
            Iterator<Map.Entry<String, JsonNode>> hintFields = hints.fields();
            while (hintFields.hasNext()) {
                Map.Entry<String, JsonNode> entry = hintFields.next();
                String hintPointer = child(hintsPointer, entry.getKey());
                if (entry.getKey().startsWith(ArchitectureValidator.FORBIDDEN_PREFIX)) {
                    String module = entry.getKey().substring(ArchitectureValidator.FORBIDDEN_PREFIX.length()).trim();
                    String hint = text(entry.getValue(), hintPointer);
                    at(hintPointer, () -> builder.forbiddenHint(module, hint));
                    continue;
                }
                String[] layers = entry.getKey().split("->", -1);
                if (layers.length != 2) {
                    throw new ContractDocumentException(hintPointer,
                        "hint key must look like 'from->to' or 'forbidden::module'");
                }
                String hint = text(entry.getValue(), hintPointer);
                at(hintPointer, () -> builder.hint(layers[0].trim(), layers[1].trim(), hint));
            }
        }
        return at(pointer, builder::build);
    }
}
