package com.pytaintscanner.graph;

import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Links publishers to subscribers inside one file.
 * <ul>
 *   <li>{@code ch.basic_consume(queue=Q, on_message_callback=h)} subscribes {@code h} to queue
 *       {@code Q}; {@code ch.basic_publish(routing_key=Q, ...)} calls every subscriber of {@code Q}
 *       (mechanism {@code mq}).</li>
 *   <li>{@code sig.connect(h)} subscribes {@code h} to {@code sig}; {@code sig.send(...)} calls
 *       every subscriber of {@code sig} (mechanism {@code signal}).</li>
 * </ul>
 * Subscriptions are collected over the whole file before publishers are linked, so the order of
 * the two in the source does not matter.
 */
public class PubSubEnricher implements GraphEnricher {
    private static final Logger logger = LoggerFactory.getLogger(PubSubEnricher.class);

    public static final String MECHANISM_MQ = "mq";
    public static final String MECHANISM_SIGNAL = "signal";

    @Override
    public String getName() {
        return "pubsub";
    }

    @Override
    public void enrich(IrGraph graph, CallSites callSites, ModuleIndex index) {
        Map<String, List<IrNode>> queues = new LinkedHashMap<>();
        Map<String, List<IrNode>> signals = new LinkedHashMap<>();
        List<IrNode> calls = graph.nodesOfKind(NodeKind.CALL);

        for (IrNode call : calls) {
            IrNode callee = graph.node(call.stringAttr("callee_id"));
            if (callee == null || !NodeKind.ATTRIBUTE.equals(callee.getKind())) {
                continue;
            }
            String attr = callee.stringAttr("attr");
            if ("basic_consume".equals(attr)) {
                String queue = keyOf(graph, keyword(graph, call, "queue"));
                IrNode handler = keyword(graph, call, "on_message_callback");
                if (queue != null && handler != null) {
                    queues.computeIfAbsent(queue, k -> new ArrayList<>()).addAll(handlers(graph, call, handler, index));
                }
            } else if ("connect".equals(attr)) {
                String signal = graph.dottedName(callee.stringAttr("value_id"));
                IrNode handler = positional(graph, call, 0);
                if (signal != null && handler != null) {
                    signals.computeIfAbsent(signal, k -> new ArrayList<>()).addAll(handlers(graph, call, handler, index));
                }
            }
        }

        int linked = 0;
        for (IrNode call : calls) {
            IrNode callee = graph.node(call.stringAttr("callee_id"));
            if (callee == null || !NodeKind.ATTRIBUTE.equals(callee.getKind())) {
                continue;
            }
            String attr = callee.stringAttr("attr");
            if ("basic_publish".equals(attr)) {
                String queue = keyOf(graph, keyword(graph, call, "routing_key"));
                linked += link(graph, callSites, call, queues.get(queue), MECHANISM_MQ);
            } else if ("send".equals(attr)) {
                String signal = graph.dottedName(callee.stringAttr("value_id"));
                linked += link(graph, callSites, call, signals.get(signal), MECHANISM_SIGNAL);
            }
        }
        if (linked > 0) {
            logger.debug("Added {} publish/subscribe edges in {}", linked, graph.getFilePath());
        }
    }

    private int link(IrGraph graph, CallSites callSites, IrNode call, List<IrNode> handlers, String mechanism) {
        if (handlers == null) {
            return 0;
        }
        int count = 0;
        for (IrNode handler : handlers) {
            callSites.add(call.getId(), CallTarget.synthetic(handler.getId(), handler.stringAttr("qualified_name"), mechanism));
            graph.addEdge(IrEdge.of(call.getId(), handler.getId(), EdgeType.CALL));
            call.putAttr("synthetic_mechanism", mechanism);
            count++;
        }
        return count;
    }

    private List<IrNode> handlers(IrGraph graph, IrNode call, IrNode handler, ModuleIndex index) {
        List<IrNode> out = new ArrayList<>();
        String name = NodeKind.NAME.equals(handler.getKind()) ? handler.stringAttr("name")
                : NodeKind.ATTRIBUTE.equals(handler.getKind()) ? handler.stringAttr("attr") : null;
        if (name == null) {
            return out;
        }
        String qualified = handler.stringAttr("qualified_name");
        if (qualified != null) {
            ModuleIndex.FunctionEntry fn = index.function(qualified);
            if (fn != null && graph.getFilePath().equals(fn.getFilePath())) {
                out.add(graph.node(fn.getNodeId()));
                return out;
            }
        }
        for (ModuleIndex.FunctionEntry fn : index.functionsNamed(name)) {
            if (graph.getFilePath().equals(fn.getFilePath()) && graph.node(fn.getNodeId()) != null) {
                out.add(graph.node(fn.getNodeId()));
            }
        }
        if (out.isEmpty()) {
            logger.debug("No handler '{}' found for subscription at {}", name, call.getId());
        }
        return out;
    }

    private static String keyOf(IrGraph graph, IrNode value) {
        if (value == null) {
            return null;
        }
        if (NodeKind.LITERAL.equals(value.getKind()) && "str".equals(value.stringAttr("value_type"))) {
            return "'" + value.stringAttr("value") + "'";
        }
        return graph.dottedName(value.getId());
    }

    private static IrNode keyword(IrGraph graph, IrNode call, String name) {
        for (String kwId : call.listAttr("keywords")) {
            IrNode kw = graph.node(kwId);
            if (kw != null && name.equals(kw.stringAttr("name"))) {
                return graph.node(kw.stringAttr("value_id"));
            }
        }
        return null;
    }

    private static IrNode positional(IrGraph graph, IrNode call, int index) {
        List<String> args = call.listAttr("args");
        return args.size() > index ? graph.node(args.get(index)) : null;
    }
}
