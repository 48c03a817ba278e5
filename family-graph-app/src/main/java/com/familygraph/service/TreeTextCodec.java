package com.familygraph.service;

import com.familygraph.model.Card;
import com.familygraph.model.TreeEdit;
import com.familygraph.model.TreeEdit.NewLayer;
import com.familygraph.model.TreeEdit.NewRightmostNode;
import com.familygraph.model.TreeEdit.SetAsChild;
import com.familygraph.store.EditEngine;
import com.familygraph.store.GenerationIndexSettings;
import com.familygraph.store.NodeStore;
import com.familygraph.store.TreeEditException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compact text form of a forest's shape and names, used for fixtures and snapshots.
 *
 * <pre>
 * tree  := layer (";" layer)* ";"?
 * layer := (node ("," node)*)?
 * node  := name ("(" name ("," name)* ")")?
 * </pre>
 *
 * Names are the only cross-reference key, so they must be unique and must not contain
 * any of {@code ( ) , ;}. Encoding terminates every layer with {@code ;} and drops empty
 * child lists.
 *
 * A layer may be empty ({@code "a;;b"}). Deleting a node leaves its layer in place until the
 * caller collapses it, and such stores must survive a snapshot.
 */
@Service
public class TreeTextCodec {

    private static final Pattern NODE_TOKEN = Pattern.compile(
        "\\G(?<name>[^(),;]+)(?:\\((?<children>[^(),;]*(?:,[^(),;]*)*)\\))?(?:,|$)");

    // ========== ENCODE ==========

    public String encode(NodeStore store) {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < store.layerCount(); y++) {
            List<String> nodeStrs = new ArrayList<>();
            for (int id : store.layer(y)) {
                StringBuilder nodeStr = new StringBuilder(store.card(id).name());
                List<Integer> childIds = store.childIds(id);
                if (!childIds.isEmpty()) {
                    List<String> childNames = childIds.stream()
                        .map(childId -> store.card(childId).name())
                        .toList();
                    nodeStr.append('(').append(String.join(",", childNames)).append(')');
                }
                nodeStrs.add(nodeStr.toString());
            }
            sb.append(String.join(",", nodeStrs)).append(';');
        }
        return sb.toString();
    }

    // ========== DECODE ==========

    public NodeStore decode(String text) {
        return decode(text, GenerationIndexSettings::new);
    }

    /**
     * Build a store from its text form. Ids are assigned layer by layer, left to right,
     * in the order names first appear.
     */
    public NodeStore decode(String text, Supplier<GenerationIndexSettings> settings) {
        List<List<ParsedNode>> layers = parse(text);

        NodeStore store = new NodeStore(settings.get());
        EditEngine engine = new EditEngine(store);
        Map<String, Integer> idsByName = new HashMap<>();
        List<TreeEdit> edits = new ArrayList<>();
        for (int y = 0; y < layers.size(); y++) {
            edits.add(new NewLayer(y));
            for (ParsedNode node : layers.get(y)) {
                if (idsByName.containsKey(node.name())) {
                    throw new TreeFormatException("Duplicate name '" + node.name() + "'");
                }
                int id = store.obtainId();
                idsByName.put(node.name(), id);
                edits.add(new NewRightmostNode(y, id, Card.named(node.name())));
            }
        }
        engine.apply(edits);

        for (int y = 0; y < layers.size(); y++) {
            for (ParsedNode node : layers.get(y)) {
                int parentId = idsByName.get(node.name());
                for (String childName : node.children()) {
                    Integer childId = idsByName.get(childName);
                    if (childId == null) {
                        throw new TreeFormatException(
                            "Unresolved child name '" + childName + "' under '" + node.name() + "'");
                    }
                    try {
                        engine.apply(new SetAsChild(parentId, childId));
                    } catch (TreeEditException e) {
                        throw new TreeFormatException(
                            "Invalid relation '" + node.name() + "' -> '" + childName + "': " + e.getMessage(), e);
                    }
                }
            }
        }
        return store;
    }

    private List<List<ParsedNode>> parse(String text) {
        List<List<ParsedNode>> layers = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return layers;
        }
        String body = text.endsWith(";") ? text.substring(0, text.length() - 1) : text;
        for (String layerStr : body.split(";", -1)) {
            layers.add(parseLayer(layerStr));
        }
        return layers;
    }

    private List<ParsedNode> parseLayer(String layerStr) {
        List<ParsedNode> nodes = new ArrayList<>();
        if (layerStr.isEmpty()) {
            return nodes;
        }
        Matcher matcher = NODE_TOKEN.matcher(layerStr);
        int end = 0;
        while (end < layerStr.length() && matcher.find()) {
            String childrenStr = matcher.group("children");
            List<String> children = new ArrayList<>();
            if (childrenStr != null && !childrenStr.isEmpty()) {
                for (String childName : childrenStr.split(",", -1)) {
                    if (childName.isEmpty()) {
                        throw new TreeFormatException("Empty child name in '" + matcher.group() + "'");
                    }
                    children.add(childName);
                }
            }
            nodes.add(new ParsedNode(matcher.group("name"), children));
            end = matcher.end();
            if (matcher.group().endsWith(",") && end == layerStr.length()) {
                throw new TreeFormatException("Trailing ',' in layer '" + layerStr + "'");
            }
        }
        if (end != layerStr.length()) {
            throw new TreeFormatException(describeFailure(layerStr, end));
        }
        return nodes;
    }

    private String describeFailure(String layerStr, int offset) {
        String rest = layerStr.substring(offset);
        long opens = rest.chars().filter(c -> c == '(').count();
        long closes = rest.chars().filter(c -> c == ')').count();
        if (opens != closes) {
            return "Unmatched parenthesis near '" + rest + "'";
        }
        return "Malformed node token near '" + rest + "'";
    }

    private record ParsedNode(String name, List<String> children) {}

    public static class TreeFormatException extends RuntimeException {
        public TreeFormatException(String message) {
            super(message);
        }

        public TreeFormatException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
