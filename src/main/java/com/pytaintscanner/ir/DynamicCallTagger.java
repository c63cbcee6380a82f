package com.pytaintscanner.ir;

import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Marks calls whose target or arguments are decided at run time: reflection-style builtins,
 * {@code import_module}, callees that are not plain names, and {@code **mapping} arguments.
 */
public class DynamicCallTagger {
    private static final Logger logger = LoggerFactory.getLogger(DynamicCallTagger.class);

    public static final String TAG_DYNAMIC = "dynamic";
    public static final String TAG_UNSCANNABLE = "unscannable";

    private static final Set<String> DYNAMIC_BUILTINS = Set.of(
            "eval", "exec", "compile", "__import__", "getattr", "setattr");

    public void tag(IrGraph graph) {
        int tagged = 0;
        for (IrNode call : graph.nodesOfKind(NodeKind.CALL)) {
            IrNode callee = graph.node(call.stringAttr("callee_id"));
            boolean unscannable;
            if (callee == null) {
                unscannable = true;
            } else if (NodeKind.NAME.equals(callee.getKind())) {
                unscannable = DYNAMIC_BUILTINS.contains(callee.stringAttr("name"));
            } else if (NodeKind.ATTRIBUTE.equals(callee.getKind())) {
                unscannable = "import_module".equals(callee.stringAttr("attr"));
            } else {
                unscannable = true;
            }
            if (unscannable) {
                call.addTag(TAG_DYNAMIC);
                call.addTag(TAG_UNSCANNABLE);
                call.putAttr("unscannable", true);
                tagged++;
            }
            for (String kwId : call.listAttr("keywords")) {
                IrNode kw = graph.node(kwId);
                if (kw != null && kw.stringAttr("name") == null) {
                    call.addTag(TAG_DYNAMIC);
                }
            }
        }
        if (tagged > 0) {
            logger.debug("Tagged {} dynamic call sites in {}", tagged, graph.getFilePath());
        }
    }
}
