package org.tacheck.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.tacheck.automata.base.Action;
import org.tacheck.automata.base.Alphabet;
import org.tacheck.automata.base.Edge;
import org.tacheck.automata.base.Location;
import org.tacheck.automata.base.SyncType;
import org.tacheck.automata.models.SystemModel;
import org.tacheck.automata.models.TimedAutomaton;
import org.tacheck.core.Clock;
import org.tacheck.exceptions.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 从 JSON 读取模型：
 * <pre>
 * { "components": [ { "name": "A", "clocks": ["x"], "inputs": ["a"], "outputs": ["b"],
 *     "locations": [ { "id": "L0", "invariant": "x <= 5", "initial": true, "urgent": false } ],
 *     "edges": [ { "source": "L0", "target": "L1", "sync": "a", "type": "INPUT",
 *                  "guard": "x >= 2", "update": "x = 0" } ] } ] }
 * </pre>
 * 缺省的 sync 表示静默边。所有结构错误都以 {@link ModelException} 报告。
 */
public final class ModelLoader {

    private static final Logger logger = LoggerFactory.getLogger(ModelLoader.class);

    private final ObjectMapper mapper;

    public ModelLoader() {
        this.mapper = new ObjectMapper();
    }

    /**
     * @throws IOException    文件无法读取
     * @throws ModelException 文件内容不是合法的模型
     */
    public SystemModel load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            SystemModel model = load(in);
            logger.info("从 {} 加载模型: {}", path, model.getComponentNames());
            return model;
        }
    }

    public SystemModel load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ModelException("模型不是合法的 JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    public SystemModel fromJson(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelException("模型不是合法的 JSON: " + e.getOriginalMessage(), e);
        }
        return read(root);
    }

    private SystemModel read(JsonNode root) {
        if (root == null || !root.path("components").isArray()) {
            throw new ModelException("模型缺少 components 数组");
        }
        List<TimedAutomaton> automata = new ArrayList<>();
        for (JsonNode node : root.get("components")) {
            automata.add(readComponent(node));
        }
        return SystemModel.of(automata);
    }

    TimedAutomaton readComponent(JsonNode node) {
        String name = requiredText(node, "name", "组件");
        String where = "组件 " + name;

        List<Clock> clocks = new ArrayList<>();
        for (String clockName : textList(node, "clocks", where)) {
            clocks.add(Clock.of(name, clockName));
        }
        Alphabet alphabet = Alphabet.ofLabels(textList(node, "inputs", where), textList(node, "outputs", where));

        List<Location> locations = new ArrayList<>();
        for (JsonNode locationNode : array(node, "locations", where)) {
            String id = requiredText(locationNode, "id", where + " 的位置");
            locations.add(Location.of(id,
                    ConstraintText.parseConstraints(locationNode.path("invariant").asText(""), name, clocks,
                            where + " 位置 " + id + " 的不变量"),
                    locationNode.path("initial").asBoolean(false),
                    locationNode.path("urgent").asBoolean(false)));
        }

        List<Edge> edges = new ArrayList<>();
        for (JsonNode edgeNode : array(node, "edges", where)) {
            String source = requiredText(edgeNode, "source", where + " 的边");
            String target = requiredText(edgeNode, "target", where + " 的边");
            String edgeWhere = where + " 的边 " + source + " -> " + target;
            Action action = Action.of(edgeNode.path("sync").asText(""));
            SyncType type = syncType(edgeNode, action, alphabet, edgeWhere);
            edges.add(new Edge(findLocation(locations, source, edgeWhere), findLocation(locations, target, edgeWhere),
                    action, type,
                    ConstraintText.parseConstraints(edgeNode.path("guard").asText(""), name, clocks, edgeWhere + " 的守卫"),
                    ConstraintText.parseUpdates(edgeNode.path("update").asText(""), name, clocks, edgeWhere + " 的更新")));
        }
        return new TimedAutomaton(name, clocks, alphabet, locations, edges);
    }

    private static SyncType syncType(JsonNode edgeNode, Action action, Alphabet alphabet, String where) {
        String declared = edgeNode.path("type").asText("");
        if (declared.isEmpty()) {
            // 未声明方向时由字母表推断，静默边记为输出
            return alphabet.isInput(action) ? SyncType.INPUT : SyncType.OUTPUT;
        }
        try {
            return SyncType.valueOf(declared.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ModelException(where + " 的方向必须是 INPUT 或 OUTPUT: " + declared, e);
        }
    }

    private static Location findLocation(List<Location> locations, String name, String where) {
        for (Location location : locations) {
            if (location.getName().equals(name)) {
                return location;
            }
        }
        logger.error("{} 引用了不存在的位置 {}", where, name);
        throw new ModelException(where + " 引用了不存在的位置 " + name);
    }

    private static String requiredText(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new ModelException(where + " 缺少字段 " + field);
        }
        return value.asText();
    }

    private static Iterable<JsonNode> array(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new ModelException(where + " 的字段 " + field + " 必须是数组");
        }
        return value;
    }

    private static List<String> textList(JsonNode node, String field, String where) {
        List<String> values = new ArrayList<>();
        for (JsonNode element : array(node, field, where)) {
            if (!element.isTextual()) {
                throw new ModelException(where + " 的字段 " + field + " 只能包含字符串");
            }
            values.add(element.asText());
        }
        return values;
    }
}
