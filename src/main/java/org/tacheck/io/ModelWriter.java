package org.tacheck.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.base.Location;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Collection;

/**
 * 把组件写成 {@link ModelLoader} 读取的 JSON 格式。
 */
public final class ModelWriter {

    private static final Logger logger = LoggerFactory.getLogger(ModelWriter.class);

    private final ObjectMapper mapper;

    public ModelWriter() {
        this.mapper = new ObjectMapper();
    }

    public ObjectNode toJson(Collection<TimedAutomaton> automata) {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode components = root.putArray("components");
        for (TimedAutomaton automaton : automata) {
            components.add(toJson(automaton));
        }
        return root;
    }

    public ObjectNode toJson(TimedAutomaton automaton) {
        ObjectNode node = mapper.createObjectNode();
        node.put("name", automaton.getName());
        ArrayNode clocks = node.putArray("clocks");
        for (Clock clock : automaton.getClocks()) {
            clocks.add(clock.getName());
        }
        ArrayNode inputs = node.putArray("inputs");
        automaton.getInputs().forEach(action -> inputs.add(action.getLabel()));
        ArrayNode outputs = node.putArray("outputs");
        automaton.getOutputs().forEach(action -> outputs.add(action.getLabel()));

        ArrayNode locations = node.putArray("locations");
        for (Location location : automaton.getLocations()) {
            ObjectNode locationNode = locations.addObject();
            locationNode.put("id", location.getName());
            if (location.hasInvariant()) {
                locationNode.put("invariant", ConstraintText.formatConstraints(location.getInvariant()));
            }
            locationNode.put("initial", location.isInitial());
            locationNode.put("urgent", location.isUrgent());
        }

        ArrayNode edges = node.putArray("edges");
        for (Edge edge : automaton.getEdges()) {
            ObjectNode edgeNode = edges.addObject();
            edgeNode.put("source", edge.getSource().getName());
            edgeNode.put("target", edge.getTarget().getName());
            Action action = edge.getAction();
            if (!action.isEpsilon()) {
                edgeNode.put("sync", action.getLabel());
            }
            edgeNode.put("type", edge.getSyncType().name());
            if (!edge.getGuard().isEmpty()) {
                edgeNode.put("guard", ConstraintText.formatConstraints(edge.getGuard()));
            }
            if (!edge.getResetSet().isEmpty()) {
                edgeNode.put("update", ConstraintText.formatUpdates(edge.getResetSet()));
            }
        }
        return node;
    }

    public String writeString(Collection<TimedAutomaton> automata) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(automata));
    }

    public void write(Collection<TimedAutomaton> automata, Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        try (OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(out, toJson(automata));
        }
        logger.info("写出 {} 个组件到 {}", automata.size(), path);
    }
}
