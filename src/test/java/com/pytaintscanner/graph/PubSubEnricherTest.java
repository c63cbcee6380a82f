package com.pytaintscanner.graph;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PubSubEnricherTest {

    private static CallSites enrich(IrGraph graph) {
        ModuleIndex index = ModuleIndex.build(List.of(graph));
        CallSites sites = new SpeculativeCallResolver(index, 5).resolve(graph);
        new PubSubEnricher().enrich(graph, sites, index);
        return sites;
    }

    private static IrNode callByAttr(IrGraph graph, String attr) {
        for (IrNode call : graph.nodesOfKind(NodeKind.CALL)) {
            IrNode callee = graph.node(call.stringAttr("callee_id"));
            if (callee != null && attr.equals(callee.stringAttr("attr"))) {
                return call;
            }
        }
        throw new AssertionError("no call to ." + attr);
    }

    @Test
    void publishCallsQueueConsumer() throws Exception {
        IrGraph graph = Fixtures.ir("mq.py", String.join("\n",
                "def publish(ch, body):",
                "    ch.basic_publish(exchange='', routing_key='jobs', body=body)",
                "",
                "def on_job(ch, method, props, body):",
                "    return body",
                "",
                "def consume(ch):",
                "    ch.basic_consume(queue='jobs', on_message_callback=on_job)",
                ""));
        CallSites sites = enrich(graph);
        IrNode publish = callByAttr(graph, "basic_publish");
        IrNode handler = Fixtures.find(graph, NodeKind.FUNCTION, "name", "on_job");

        CallTarget synthetic = sites.targetsOf(publish.getId()).stream()
                .filter(t -> t.getKind() == CallTarget.Kind.SYNTHETIC)
                .findFirst().orElseThrow(AssertionError::new);
        assertEquals(handler.getId(), synthetic.getTargetId());
        assertEquals(PubSubEnricher.MECHANISM_MQ, synthetic.getMechanism());
        assertTrue(synthetic.isSpreadArguments());
        assertEquals(PubSubEnricher.MECHANISM_MQ, publish.stringAttr("synthetic_mechanism"));
        assertTrue(graph.edgesFrom(publish.getId(), EdgeType.CALL).stream()
                .anyMatch(e -> e.getTo().equals(handler.getId())));
    }

    @Test
    void otherQueueIsNotLinked() throws Exception {
        IrGraph graph = Fixtures.ir("mq.py", String.join("\n",
                "def on_job(ch, method, props, body):",
                "    return body",
                "ch.basic_consume(queue='jobs', on_message_callback=on_job)",
                "ch.basic_publish(exchange='', routing_key='audit', body=data)",
                ""));
        CallSites sites = enrich(graph);
        IrNode publish = callByAttr(graph, "basic_publish");

        assertTrue(sites.targetsOf(publish.getId()).stream().noneMatch(t -> t.getKind() == CallTarget.Kind.SYNTHETIC));
        assertNull(publish.stringAttr("synthetic_mechanism"));
    }

    @Test
    void signalSendReachesConnectedReceiver() throws Exception {
        IrGraph graph = Fixtures.ir("sig.py", String.join("\n",
                "def receiver(sender, **kwargs):",
                "    return kwargs",
                "saved.connect(receiver)",
                "saved.send(sender, payload=data)",
                ""));
        CallSites sites = enrich(graph);
        IrNode send = callByAttr(graph, "send");

        assertTrue(sites.targetsOf(send.getId()).stream()
                .anyMatch(t -> PubSubEnricher.MECHANISM_SIGNAL.equals(t.getMechanism())));
    }
}
