package com.loopcost.estimator.render;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.loopcost.estimator.model.IterationFactor;
import com.loopcost.estimator.model.LoopNode;

import java.util.Objects;
import java.util.Optional;

/**
 * Serializes a loop tree to JSON. The root is {@code {"node": "Global Root", "children": [...]}},
 * loops are {@code {"node": "For"|"While", "iterable": tag-or-null, "children": [...]}}.
 */
public class LoopTreeJsonWriter {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

    public String write(LoopNode root) {
        return gson.toJson(toJsonTree(root));
    }

    public JsonObject toJsonTree(LoopNode node) {
        Objects.requireNonNull(node, "node");
        JsonObject json = new JsonObject();
        json.addProperty("node", node.getKind().getLabel());
        if (node.getKind() != LoopNode.Kind.ROOT) {
            Optional<IterationFactor> factor = node.getIterationFactor();
            if (factor.isPresent()) {
                json.addProperty("iterable", factor.get().getTag());
            } else {
                json.add("iterable", JsonNull.INSTANCE);
            }
        }
        JsonArray children = new JsonArray();
        for (LoopNode child : node.getChildren()) {
            children.add(toJsonTree(child));
        }
        json.add("children", children);
        return json;
    }
}
