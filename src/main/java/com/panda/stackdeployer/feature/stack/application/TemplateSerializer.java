package com.panda.stackdeployer.feature.stack.application;

import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.nodes.CollectionNode;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.SequenceNode;

import java.io.StringWriter;
import java.util.Map;

/**
 * Renders a template document as YAML.
 *
 * Block style with an indent of 4; collections nested {@value #FLOW_LEVEL} levels deep or
 * more are written in flow style so deeply nested intrinsics stay on one line.
 */
@Component
public class TemplateSerializer {

    static final int FLOW_LEVEL = 16;
    private static final int INDENT = 4;

    public String toYaml(Map<String, Object> template) {
        DumperOptions options = new DumperOptions();
        options.setIndent(INDENT);
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        Yaml yaml = new Yaml(options);

        Node root = yaml.represent(template);
        flattenBeyond(root, 0);

        StringWriter writer = new StringWriter();
        yaml.serialize(root, writer);
        return writer.toString();
    }

    private static void flattenBeyond(Node node, int level) {
        if (!(node instanceof CollectionNode)) {
            return;
        }
        if (level >= FLOW_LEVEL) {
            ((CollectionNode<?>) node).setFlowStyle(DumperOptions.FlowStyle.FLOW);
        }
        if (node instanceof MappingNode) {
            for (NodeTuple tuple : ((MappingNode) node).getValue()) {
                flattenBeyond(tuple.getValueNode(), level + 1);
            }
        } else if (node instanceof SequenceNode) {
            for (Node child : ((SequenceNode) node).getValue()) {
                flattenBeyond(child, level + 1);
            }
        }
    }
}
