package com.smartchoice.config.loader;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.smartchoice.cel.CelPayoff;
import com.smartchoice.common.errorsor.ErrorsOr;
import com.smartchoice.config.BranchDefinition;
import com.smartchoice.config.ChanceDefinition;
import com.smartchoice.config.DecisionDefinition;
import com.smartchoice.config.NodeDefinition;
import com.smartchoice.config.OverrideDefinition;
import com.smartchoice.config.PayoffRegistry;
import com.smartchoice.config.TerminalDefinition;
import com.smartchoice.config.TreeDefinition;
import com.smartchoice.tree.error.DecisionTreeException;
import com.smartchoice.tree.spec.ChanceBranch;
import com.smartchoice.tree.spec.DecisionBranch;
import com.smartchoice.tree.spec.NodeSpecBag;
import com.smartchoice.tree.spec.PayoffFn;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public interface TreeDefinitionLoader {

    /* ------------ Cached Jackson instances (thread-safe) ------------ */
    ObjectMapper JSON = base(new ObjectMapper());
    ObjectReader DEFINITION_READER = JSON.readerFor(TreeDefinition.class);

    /* ---------------- Public API ---------------- */

    static TreeDefinition fromJson(InputStream in) throws IOException {
        return DEFINITION_READER.readValue(in);
    }

    static TreeDefinition fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    static TreeDefinition fromJson(String json) throws IOException {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        }
    }

    /** Reads and converts in one go; read failures become errors too. */
    static ErrorsOr<NodeSpecBag> load(InputStream in, PayoffRegistry registry) {
        try {
            return toNodeSpecBag(fromJson(in), registry);
        } catch (IOException e) {
            return ErrorsOr.error("Cannot read tree definition: " + e.getMessage());
        }
    }

    /**
     * Converts a definition into a bag. Every node, payoff and override is tried, and all
     * problems are returned together.
     */
    static ErrorsOr<NodeSpecBag> toNodeSpecBag(TreeDefinition definition, PayoffRegistry registry) {
        List<String> errors = new ArrayList<>();
        if (definition.nodes().isEmpty()) errors.add("Tree definition has no nodes");

        NodeSpecBag bag = new NodeSpecBag(definition.probabilityPolicy());
        Set<String> seen = new HashSet<>();
        for (NodeDefinition node : definition.nodes()) {
            if (!seen.add(node.name())) {
                errors.add("Node " + node.name() + " is defined more than once");
                continue;
            }
            try {
                if (node instanceof DecisionDefinition d) {
                    bag.addDecision(d.name(), decisionBranches(d), d.maximize());
                } else if (node instanceof ChanceDefinition c) {
                    ErrorsOr<List<ChanceBranch>> branches = chanceBranches(c);
                    if (branches.isError()) errors.addAll(branches.getErrors());
                    else bag.addChance(c.name(), branches.valueOrThrow());
                } else if (node instanceof TerminalDefinition t) {
                    ErrorsOr<Optional<PayoffFn>> payoff = payoff(t, registry);
                    if (payoff.isError()) errors.addAll(payoff.getErrors());
                    else bag.addTerminal(t.name(), payoff.valueOrThrow().orElse(null));
                }
            } catch (DecisionTreeException e) {
                errors.add(e.getMessage());
            }
        }
        for (OverrideDefinition o : definition.dependentProbabilities()) {
            try {
                bag.setProbability(o.value(), o.conditions());
            } catch (DecisionTreeException e) {
                errors.add("Dependent probability " + o.value() + ": " + e.getMessage());
            }
        }
        for (OverrideDefinition o : definition.dependentOutcomes()) {
            try {
                bag.setOutcome(o.value(), o.conditions());
            } catch (DecisionTreeException e) {
                errors.add("Dependent outcome " + o.value() + ": " + e.getMessage());
            }
        }
        return ErrorsOr.liftOrErrors(bag, errors);
    }

    private static List<DecisionBranch> decisionBranches(DecisionDefinition d) {
        List<DecisionBranch> branches = new ArrayList<>(d.branches().size());
        for (BranchDefinition b : d.branches()) branches.add(new DecisionBranch(b.label(), b.value(), b.next()));
        return branches;
    }

    private static ErrorsOr<List<ChanceBranch>> chanceBranches(ChanceDefinition c) {
        List<String> errors = new ArrayList<>();
        List<ChanceBranch> branches = new ArrayList<>(c.branches().size());
        for (int i = 0; i < c.branches().size(); i++) {
            BranchDefinition b = c.branches().get(i);
            if (b.probability() == null) {
                errors.add("Branch #" + i + " of variable " + c.name() + " has no probability");
            } else {
                branches.add(new ChanceBranch(b.label(), b.probability(), b.value(), b.next()));
            }
        }
        return ErrorsOr.liftOrErrors(branches, errors);
    }

    /** Named payoff first, then a CEL expression. Empty when the terminal has neither. */
    private static ErrorsOr<Optional<PayoffFn>> payoff(TerminalDefinition t, PayoffRegistry registry) {
        if (t.payoff() != null) {
            Optional<PayoffFn> named = registry.find(t.payoff());
            if (named.isEmpty()) {
                return ErrorsOr.error("Terminal " + t.name() + " refers to unknown payoff "
                        + t.payoff() + ". Known: " + registry.names());
            }
            return ErrorsOr.lift(named);
        }
        if (t.expression() != null) {
            return CelPayoff.compile(t.expression())
                    .addPrefixIfError("Terminal " + t.name() + ": ")
                    .map(Optional::of);
        }
        return ErrorsOr.lift(Optional.empty());
    }

    /* --------------- Jackson setup (kept internal) --------------- */

    private static ObjectMapper base(ObjectMapper om) {
        return om
                // Open to extension: ignore extra fields in JSON
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)

                // Let record constructors enforce required fields & defaults
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, false)

                // No silent coercion of single value -> array
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, false)

                // Keep property names case-sensitive
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, false)

                // Nice for human-authored JSON files
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());
    }
}
