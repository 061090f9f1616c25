package com.smartchoice.config.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.smartchoice.common.codec.Codec;
import com.smartchoice.common.errorsor.ErrorsOr;
import com.smartchoice.tree.DecisionTree;
import com.smartchoice.tree.NodeSnapshot;
import com.smartchoice.tree.TreeNode;

import java.util.List;

/** Serializable picture of a tree: root results plus every node. Null fields are left out of the JSON. */
public record TreeReport(String root,
                         int size,
                         boolean evaluated,
                         boolean rolledBack,
                         Double ev,
                         Double eu,
                         Double ce,
                         List<NodeSnapshot> nodes) {

    private static final Codec<TreeReport, String> CODEC = Codec.clazzCodec(
            new ObjectMapper()
                    .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                    .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS),
            TreeReport.class);

    public TreeReport {
        nodes = List.copyOf(nodes);
    }

    public static TreeReport of(DecisionTree tree) {
        TreeNode root = tree.node(0);
        return new TreeReport(root.name(), tree.size(), tree.isEvaluated(), tree.isRolledBack(),
                root.ev(), root.eu(), root.ce(), tree.snapshot());
    }

    public static ErrorsOr<String> toJson(DecisionTree tree) {
        return CODEC.encode(of(tree));
    }

    public static ErrorsOr<TreeReport> fromJson(String json) {
        return CODEC.decode(json);
    }
}
