package com.dcruver.tanaimport.convert;

import com.dcruver.tanaimport.domain.Document;
import com.dcruver.tanaimport.domain.Edge;
import com.dcruver.tanaimport.domain.GraphNode;
import com.dcruver.tanaimport.domain.NodeStore;
import com.dcruver.tanaimport.domain.TopLevelEntry;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Renders a top-level node and the nodes it owns as a Markdown outline.
 */
@Slf4j
public class OutlineRenderer {

    static final String TAG_PROPERTY_ID = "SYS_A13";
    static final String CHECKBOX_PROPERTY_ID = "SYS_A55";

    private static final String PROPERTY_DELIMITER = "---";
    private static final String HEADING_MARKER = "### ";

    private final ConversionState state;
    private final LinkResolver linkResolver;
    private final MarkupTranslator markupTranslator;
    private final String fileExtension;

    // Nodes on the current rendering path; guards against ownership cycles
    private final Set<String> renderingPath = new HashSet<>();

    public OutlineRenderer(ConversionState state, LinkResolver linkResolver, String fileExtension) {
        this.state = state;
        this.linkResolver = linkResolver;
        this.markupTranslator = new MarkupTranslator(linkResolver);
        this.fileExtension = fileExtension;
    }

    public Document render(TopLevelEntry entry) {
        List<String> fragments = new ArrayList<>();
        List<Property> properties = collectProperties(entry.getNode());
        if (!properties.isEmpty()) {
            fragments.add(PROPERTY_DELIMITER);
            for (Property property : properties) {
                fragments.add(property.getName() + ": " + property.getValue());
            }
            fragments.add(PROPERTY_DELIMITER);
        }
        renderNode(entry.getNode(), entry.getNode().getId(), fragments, 0);
        log.debug("Rendered {} with {} lines", entry.getTitle(), fragments.size());
        return new Document(entry.getTitle() + fileExtension, String.join("\n", fragments));
    }

    private void renderNode(GraphNode node, String documentNodeId, List<String> fragments, int indent) {
        if (node.isOfType(GraphNode.TYPE_JOURNAL)) {
            return;
        }
        if (node.isOfType(GraphNode.TYPE_TUPLE)) {
            state.markSeen(node);
            return;
        }

        state.markConverted(node);
        NodeMeta meta = resolveMeta(node);
        state.markAssociatedSeen(node);

        if (indent == 0) {
            if (meta.getTag() != null) {
                fragments.add("#" + meta.getTag());
            }
            if (node.getDescription() != null) {
                fragments.add(node.getDescription());
            }
        } else {
            fragments.add(bullet(node, meta, indent));
        }

        renderingPath.add(node.getId());
        for (Edge edge : state.getStore().childEdges(node)) {
            GraphNode child = edge.getTarget();
            if (edge.isOwned() && !renderingPath.contains(child.getId())
                && (!state.isTopLevel(child.getId()) || child.getId().equals(documentNodeId))) {
                renderNode(child, documentNodeId, fragments, indent + 1);
            } else {
                fragments.add(indentation(indent + 1) + "* " + linkResolver.linkTo(child.getId()));
            }
        }
        renderingPath.remove(node.getId());
    }

    private String bullet(GraphNode node, NodeMeta meta, int indent) {
        StringBuilder line = new StringBuilder(indentation(indent)).append("* ");
        if (meta.isCheckbox()) {
            line.append(node.isDone() ? "[x] " : "[ ] ");
        }
        if (node.isHeading()) {
            line.append(HEADING_MARKER);
        }
        line.append(markupTranslator.translate(node.getName()));
        if (meta.getTag() != null) {
            line.append(" #").append(meta.getTag());
        }
        if (state.hasAnchor(node.getId())) {
            line.append(" ^").append(LinkResolver.anchorOf(node.getId()));
        }
        return line.toString();
    }

    private static String indentation(int indent) {
        return "  ".repeat(indent);
    }

    /**
     * Tag and checkbox flags come from the tuples of the node's meta node.
     */
    private NodeMeta resolveMeta(GraphNode node) {
        Optional<GraphNode> metaNode = state.getStore().metaNodeOf(node);
        if (metaNode.isEmpty()) {
            return NodeMeta.NONE;
        }
        state.markSeen(metaNode.get());

        String tag = null;
        boolean checkbox = false;
        for (Property property : collectProperties(metaNode.get())) {
            if (TAG_PROPERTY_ID.equals(property.getKeyId())) {
                tag = property.getValue();
            } else if (CHECKBOX_PROPERTY_ID.equals(property.getKeyId())) {
                checkbox = true;
            }
        }
        return new NodeMeta(tag, checkbox);
    }

    /**
     * Tuple children with a resolvable property-name node and value node.
     */
    List<Property> collectProperties(GraphNode node) {
        NodeStore store = state.getStore();
        List<Property> properties = new ArrayList<>();
        for (Edge edge : store.childEdges(node)) {
            GraphNode tuple = edge.getTarget();
            if (!tuple.isOfType(GraphNode.TYPE_TUPLE) || tuple.getChildren().size() < 2) {
                continue;
            }
            GraphNode key = store.get(tuple.getChildren().get(0));
            GraphNode value = store.get(tuple.getChildren().get(1));
            if (key != null && value != null) {
                properties.add(new Property(key.getId(), nullToEmpty(key.getName()), nullToEmpty(value.getName())));
            }
        }
        return properties;
    }

    private static String nullToEmpty(String text) {
        return text != null ? text : "";
    }

    @Value
    static class Property {
        String keyId;
        String name;
        String value;
    }

    @Value
    static class NodeMeta {
        static final NodeMeta NONE = new NodeMeta(null, false);

        String tag;
        boolean checkbox;
    }
}
