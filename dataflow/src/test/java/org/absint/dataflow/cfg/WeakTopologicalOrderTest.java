package org.absint.dataflow.cfg;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.Test;

public class WeakTopologicalOrderTest {

    @Test
    public void straightLine() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("line");
        SimpleNode a = builder.addNode("a");
        SimpleNode b = builder.addNode("b");
        SimpleNode c = builder.addNode("c");
        builder.addEdge(a, b).addEdge(b, c);
        ProcedureCfg<SimpleNode, String> cfg = ProcedureCfg.normal(builder.build());

        Partition<SimpleNode> wto = cfg.getWeakTopologicalOrder();
        assertEquals("a b c", wto.toString());
        assertTrue(wto.getHeads().isEmpty());
        assertFalse(cfg.isLoopHead(b));
    }

    @Test
    public void simpleLoop() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("loop");
        SimpleNode start = builder.addNode("start");
        SimpleNode head = builder.addNode("head");
        SimpleNode body = builder.addNode("body");
        SimpleNode exit = builder.addNode("exit");
        builder.addEdge(start, head).addEdge(head, body).addEdge(body, head).addEdge(head, exit);
        ProcedureCfg<SimpleNode, String> cfg = ProcedureCfg.normal(builder.build());

        Partition<SimpleNode> wto = cfg.getWeakTopologicalOrder();
        assertEquals("start (head body) exit", wto.toString());
        assertEquals(Partition.Kind.NODE, wto.getKind());

        Partition<SimpleNode> second = ((Partition.NodeElement<SimpleNode>) wto).getNext();
        assertEquals(Partition.Kind.COMPONENT, second.getKind());
        Partition.Component<SimpleNode> component = (Partition.Component<SimpleNode>) second;
        assertSame(head, component.getHead());
        assertEquals("body", component.getRest().toString());
        assertEquals("exit", component.getNext().toString());

        assertTrue(cfg.isLoopHead(head));
        assertFalse(cfg.isLoopHead(body));
        assertFalse(cfg.isLoopHead(start));
    }

    @Test
    public void selfLoopHasEmptyBody() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("self");
        SimpleNode start = builder.addNode("start");
        SimpleNode loop = builder.addNode("loop");
        SimpleNode exit = builder.addNode("exit");
        builder.addEdge(start, loop).addEdge(loop, loop).addEdge(loop, exit);
        ProcedureCfg<SimpleNode, String> cfg = ProcedureCfg.normal(builder.build());

        Partition<SimpleNode> wto = cfg.getWeakTopologicalOrder();
        assertEquals("start (loop) exit", wto.toString());
        Partition<SimpleNode> next = ((Partition.NodeElement<SimpleNode>) wto).getNext();
        Partition.Component<SimpleNode> component = (Partition.Component<SimpleNode>) next;
        assertSame(loop, component.getHead());
        assertEquals(Partition.Kind.EMPTY, component.getRest().getKind());
        assertTrue(cfg.isLoopHead(loop));
    }

    @Test
    public void deepLoopDoesNotExhaustCallStack() {
        int length = 50_000;
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("deep");
        SimpleNode first = builder.addNode("n0");
        SimpleNode head = builder.addNode("n1");
        builder.addEdge(first, head);
        SimpleNode previous = head;
        for (int k = 2; k < length; k++) {
            SimpleNode node = builder.addNode("n" + k);
            builder.addEdge(previous, node);
            previous = node;
        }
        builder.addEdge(previous, head);
        ProcedureCfg<SimpleNode, String> cfg = ProcedureCfg.normal(builder.build());

        Partition<SimpleNode> wto = cfg.getWeakTopologicalOrder();
        assertTrue(wto.toString().startsWith("n0 (n1 n2 n3 "));
        assertTrue(wto.toString().endsWith(" n" + (length - 1) + ")"));
        assertEquals(1, wto.getHeads().size());
        assertTrue(cfg.isLoopHead(head));
        assertFalse(cfg.isLoopHead(previous));
    }

    @Test
    public void nestedLoops() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("nested");
        SimpleNode start = builder.addNode("start");
        SimpleNode outer = builder.addNode("outer");
        SimpleNode inner = builder.addNode("inner");
        SimpleNode body = builder.addNode("body");
        SimpleNode latch = builder.addNode("latch");
        SimpleNode exit = builder.addNode("exit");
        builder.addEdge(start, outer)
                .addEdge(outer, inner)
                .addEdge(inner, body)
                .addEdge(body, inner)
                .addEdge(inner, latch)
                .addEdge(latch, outer)
                .addEdge(outer, exit);
        ProcedureCfg<SimpleNode, String> cfg = ProcedureCfg.normal(builder.build());

        assertEquals(
                "start (outer (inner body) latch) exit",
                cfg.getWeakTopologicalOrder().toString());
        Set<SimpleNode> heads = new HashSet<>();
        heads.add(outer);
        heads.add(inner);
        assertEquals(heads, cfg.getWeakTopologicalOrder().getHeads());
    }

    @Test
    public void unreachableNodesAreLeftOut() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("dead");
        SimpleNode a = builder.addNode("a");
        SimpleNode dead = builder.addNode("dead");
        SimpleNode b = builder.addNode("b");
        builder.addEdge(a, b).addEdge(dead, b);
        ProcedureCfg<SimpleNode, String> cfg = ProcedureCfg.normal(builder.build());

        assertEquals("a b", cfg.getWeakTopologicalOrder().toString());
    }

    @Test
    public void exceptionalEdgesOnlyInExceptionalView() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("throwing");
        SimpleNode a = builder.addNode("a");
        SimpleNode handler = builder.addNode("handler");
        SimpleNode b = builder.addNode("b");
        builder.addEdge(a, b).addExceptionalEdge(a, handler).addEdge(handler, b);
        SimpleProcedure<String> procedure = builder.build();

        assertEquals("a b", ProcedureCfg.normal(procedure).getWeakTopologicalOrder().toString());
        assertEquals(
                "a handler b",
                ProcedureCfg.exceptional(procedure).getWeakTopologicalOrder().toString());
    }
}
