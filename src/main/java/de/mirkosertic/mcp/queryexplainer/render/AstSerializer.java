package de.mirkosertic.mcp.queryexplainer.render;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.mirkosertic.mcp.queryexplainer.tree.AndOperation;
import de.mirkosertic.mcp.queryexplainer.tree.FieldGroup;
import de.mirkosertic.mcp.queryexplainer.tree.Group;
import de.mirkosertic.mcp.queryexplainer.tree.Node;
import de.mirkosertic.mcp.queryexplainer.tree.Not;
import de.mirkosertic.mcp.queryexplainer.tree.OrOperation;
import de.mirkosertic.mcp.queryexplainer.tree.Phrase;
import de.mirkosertic.mcp.queryexplainer.tree.SearchField;
import de.mirkosertic.mcp.queryexplainer.tree.UnknownOperation;
import de.mirkosertic.mcp.queryexplainer.tree.Unsupported;
import de.mirkosertic.mcp.queryexplainer.tree.Word;

import java.util.List;

/**
 * Serializes a {@link Node} tree into a JSON object tree.
 *
 * <p>Every node becomes an object with {@code type} and {@code value}. Boolean operations,
 * negations and groups carry a {@code children} array, field scopes and field groups a single
 * {@code expr} object. No node carries both.</p>
 *
 * <pre>
 * title:("a" OR b)
 *
 * {"type":"SearchField","value":"title","expr":
 *   {"type":"FieldGroup","value":null,"expr":
 *     {"type":"OrOperation","value":null,"children":[
 *       {"type":"Phrase","value":"\"a\""},
 *       {"type":"Word","value":"b"}]}}}
 * </pre>
 */
public class AstSerializer {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    public ObjectNode serialize(final Node node) {
        final ObjectNode json = FACTORY.objectNode();
        json.put("type", node.typeName());

        if (node instanceof Word word) {
            json.put("value", word.value());
        } else if (node instanceof Phrase phrase) {
            json.put("value", phrase.value());
        } else if (node instanceof Unsupported unsupported) {
            json.put("value", unsupported.text());
        } else if (node instanceof SearchField field) {
            json.put("value", field.name());
            json.set("expr", serialize(field.expr()));
        } else if (node instanceof FieldGroup fieldGroup) {
            json.putNull("value");
            json.set("expr", serialize(fieldGroup.expr()));
        } else if (node instanceof Group group) {
            json.putNull("value");
            json.set("children", serializeAll(List.of(group.child())));
        } else if (node instanceof OrOperation or) {
            json.putNull("value");
            json.set("children", serializeAll(or.children()));
        } else if (node instanceof AndOperation and) {
            json.putNull("value");
            json.set("children", serializeAll(and.children()));
        } else if (node instanceof Not not) {
            json.putNull("value");
            json.set("children", serializeAll(not.children()));
        } else if (node instanceof UnknownOperation unknown) {
            json.putNull("value");
            json.set("children", serializeAll(unknown.children()));
        } else {
            throw new IllegalStateException("No serialization for node type " + node.typeName());
        }
        return json;
    }

    private ArrayNode serializeAll(final List<Node> nodes) {
        final ArrayNode array = FACTORY.arrayNode(nodes.size());
        for (final Node node : nodes) {
            array.add(serialize(node));
        }
        return array;
    }
}
