package org.absint.dataflow.disjunctive;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.absint.dataflow.analysis.AbstractInterpreter;
import org.absint.dataflow.analysis.AbstractInterpreters;
import org.absint.dataflow.analysis.BugInDataflow;
import org.absint.dataflow.analysis.CancellationCheck;
import org.absint.dataflow.analysis.FixpointContext;
import org.absint.dataflow.analysis.FixpointOptions;
import org.absint.dataflow.analysis.InstructionExecutor;
import org.absint.dataflow.analysis.InvariantMap;
import org.absint.dataflow.analysis.PostPair;
import org.absint.dataflow.analysis.State;
import org.absint.dataflow.analysis.VisitCount;
import org.absint.dataflow.cfg.SimpleNode;
import org.absint.dataflow.cfg.SimpleProcedure;
import org.absint.dataflow.interval.Interval;
import org.absint.dataflow.interval.IntervalStore;
import org.junit.Test;

public class DisjunctiveTransferFunctionTest {

    /**
     * Instructions are words: {@code split} forks a path in two, {@code throw} adds an exceptional
     * path, {@code abort} stops the path, {@code stuck} produces no path, {@code count} adds one
     * to {@code i} and {@code rename:x} replaces the path by one named {@code x}.
     */
    private static final class PathTransfer
            implements DisjunctReadyTransferFunction<
                    SimpleNode, String, Path, IntervalStore, Void> {
        final List<Path> executed = new ArrayList<>();

        @Override
        public ExecutionResult<Path, IntervalStore> execInstr(
                Path disjunct,
                IntervalStore nonDisjunct,
                FixpointContext<Void> context,
                SimpleNode node,
                int instrIndex,
                String instr) {
            executed.add(disjunct);
            switch (instr) {
                case "split":
                    return ExecutionResult.of(
                            Arrays.asList(
                                    Path.normal(disjunct.name + ".l"),
                                    Path.normal(disjunct.name + ".r")),
                            nonDisjunct);
                case "throw":
                    return ExecutionResult.of(
                            Arrays.asList(
                                    disjunct, new Path(disjunct.name, Path.Kind.EXCEPTIONAL)),
                            nonDisjunct);
                case "abort":
                    return ExecutionResult.single(
                            new Path(disjunct.name, Path.Kind.ABORTED), nonDisjunct);
                case "stuck":
                    return ExecutionResult.of(Collections.<Path>emptyList(), nonDisjunct);
                case "count":
                    return ExecutionResult.single(
                            disjunct, nonDisjunct.set("i", nonDisjunct.get("i").add(1)));
                default:
                    if (instr.startsWith("rename:")) {
                        return ExecutionResult.single(
                                Path.normal(instr.substring("rename:".length())), nonDisjunct);
                    }
                    throw new IllegalArgumentException(instr);
            }
        }
    }

    private final Path a = Path.normal("a");
    private final Path b = Path.normal("b");
    private final SimpleNode node = SimpleProcedure.<String>builder("p").addNode("n");
    private final PathTransfer paths = new PathTransfer();
    private final FixpointContext<Void> context =
            new FixpointContext<>(null, CancellationCheck.NONE);

    private static IntervalStore i(long value) {
        return IntervalStore.top().set("i", Interval.constant(value));
    }

    private static List<String> names(DisjunctiveState<Path, ?> state) {
        List<String> names = new ArrayList<>();
        for (Path path : state.getDisjuncts()) {
            names.add(path.toString());
        }
        return names;
    }

    private DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> transfer(
            DisjunctiveConfig config) {
        return new DisjunctiveTransferFunction<>(
                new DisjunctiveDomain<>(config, Path.STORES), paths);
    }

    private DisjunctiveState<Path, IntervalStore> execNode(
            DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf,
            State<DisjunctiveState<Path, IntervalStore>> oldState,
            DisjunctiveState<Path, IntervalStore> pre,
            String... instrs) {
        InstructionExecutor<String, DisjunctiveState<Path, IntervalStore>> executor =
                (index, state, instr) -> tf.execInstr(state, context, node, index, instr);
        return tf.execNodeInstrs(oldState, executor, pre, Arrays.asList(instrs), context);
    }

    @Test
    public void instructionStopsAtRemainingBudget() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.defaults());
        context.setRemainingDisjuncts(1);
        DisjunctiveState<Path, IntervalStore> post =
                tf.execInstr(
                        tf.getDomain().state(Arrays.asList(a, b), i(0)), context, node, 0, "split");

        assertEquals(Arrays.asList("a.l"), names(post));
        assertEquals(Arrays.asList(a), paths.executed);
    }

    @Test(expected = BugInDataflow.class)
    public void budgetIsOnlyAvailableDuringNodeExecution() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.defaults());
        tf.execInstr(tf.getDomain().singleton(a, i(0)), context, node, 0, "split");
    }

    @Test
    public void stuckInstructionKeepsNonDisjunctivePart() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.defaults());
        context.setRemainingDisjuncts(5);
        DisjunctiveState<Path, IntervalStore> post =
                tf.execInstr(tf.getDomain().singleton(a, i(3)), context, node, 0, "stuck");

        assertTrue(post.getDisjuncts().isEmpty());
        assertEquals(i(3), post.getNonDisjunct());
    }

    @Test
    public void nodeBudgetShrinksWithAccumulatedDisjuncts() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.builder().disjunctLimit(3).build());
        DisjunctiveState<Path, IntervalStore> post =
                execNode(tf, null, tf.getDomain().state(Arrays.asList(a, b), i(0)), "split");

        assertEquals(Arrays.asList("a.l", "a.r", "b.l"), names(post));
    }

    @Test
    public void revisitSkipsDisjunctsOfPreviousPre() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.defaults());
        DisjunctiveDomain<Path, IntervalStore> domain = tf.getDomain();
        State<DisjunctiveState<Path, IntervalStore>> oldState =
                new State<>(
                        domain.singleton(a, i(0)), domain.singleton(a, i(1)), VisitCount.first());

        DisjunctiveState<Path, IntervalStore> post =
                execNode(tf, oldState, domain.state(Arrays.asList(a, b), i(0)), "count");

        assertEquals(Arrays.asList(b), paths.executed);
        assertEquals(Arrays.asList(a, b), post.getDisjuncts());
        assertEquals(i(1), post.getNonDisjunct());
    }

    @Test
    public void exhaustedNodeGoesToTop() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.defaults());
        DisjunctiveState<Path, IntervalStore> post =
                execNode(tf, null, tf.getDomain().singleton(a, i(0)), "abort");

        assertEquals(Arrays.asList("a(ABORTED)"), names(post));
        assertEquals(IntervalStore.top(), post.getNonDisjunct());
    }

    @Test
    public void exhaustedNodeGoesToBottomWhenConfigured() {
        DisjunctiveTransferFunction<SimpleNode, String, Path, IntervalStore, Void> tf =
                transfer(DisjunctiveConfig.builder().bottomWhenExhausted(true).build());
        DisjunctiveState<Path, IntervalStore> post =
                execNode(tf, null, tf.getDomain().singleton(a, i(0)), "abort");

        assertTrue(post.getNonDisjunct().isBottom());
    }

    @Test
    public void engineForksPathsUpToLimit() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("fork");
        SimpleNode start = builder.addNode("start", "split");
        SimpleNode exit = builder.addNode("exit", "count");
        SimpleProcedure<String> procedure = builder.addEdge(start, exit).build();

        DisjunctiveDomain<Path, IntervalStore> wide = Path.domain(20);
        DisjunctiveState<Path, IntervalStore> post =
                AbstractInterpreters.disjunctive(wide, paths, FixpointOptions.defaults())
                        .computePost(null, wide.singleton(a, i(0)), procedure);
        assertEquals(Arrays.asList("a.l", "a.r"), names(post));
        assertEquals(i(1), post.getNonDisjunct());

        DisjunctiveDomain<Path, IntervalStore> narrow = Path.domain(1);
        post =
                AbstractInterpreters.disjunctive(narrow, paths, FixpointOptions.defaults())
                        .computePost(null, narrow.singleton(a, i(0)), procedure);
        assertEquals(Arrays.asList("a.l"), names(post));
    }

    @Test
    public void mergeAtLimitKeepsPathOfLastPredecessor() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("diamond");
        SimpleNode start = builder.addNode("start");
        SimpleNode left = builder.addNode("left", "rename:left");
        SimpleNode right = builder.addNode("right", "rename:right");
        SimpleNode merge = builder.addNode("merge");
        SimpleProcedure<String> procedure =
                builder.addEdge(start, left)
                        .addEdge(start, right)
                        .addEdge(left, merge)
                        .addEdge(right, merge)
                        .build();

        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(1);
        DisjunctiveState<Path, IntervalStore> post =
                AbstractInterpreters.disjunctive(domain, paths, FixpointOptions.defaults())
                        .computePost(null, domain.singleton(a, i(0)), procedure);
        assertEquals(Arrays.asList("right"), names(post));
    }

    @Test
    public void exceptionalPathsReachExceptionSink() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("thrower");
        SimpleNode start = builder.addNode("start", "throw");
        SimpleNode exit = builder.addNode("exit");
        SimpleNode sink = builder.addNode("sink");
        SimpleProcedure<String> procedure =
                builder.addEdge(start, exit)
                        .addExceptionalEdge(start, sink)
                        .setExitNode(exit)
                        .setExceptionSinkNode(sink)
                        .build();

        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(20);
        PostPair<DisjunctiveState<Path, IntervalStore>> posts =
                AbstractInterpreters.disjunctive(domain, paths, FixpointOptions.defaults())
                        .computePostIncludingExceptional(
                                null, domain.singleton(a, i(0)), procedure, false);

        assertEquals(Arrays.asList("a"), names(posts.getExitPost()));
        assertEquals(Arrays.asList("a!"), names(posts.getExceptionSinkPost()));
    }

    @Test
    public void loopTerminatesWithWidenedCounter() {
        SimpleProcedure.Builder<String> builder = SimpleProcedure.builder("loop");
        SimpleNode start = builder.addNode("start");
        SimpleNode head = builder.addNode("head");
        SimpleNode body = builder.addNode("body", "count");
        SimpleNode exit = builder.addNode("exit");
        SimpleProcedure<String> procedure =
                builder.addEdge(start, head)
                        .addEdge(head, body)
                        .addEdge(body, head)
                        .addEdge(head, exit)
                        .build();

        DisjunctiveDomain<Path, IntervalStore> domain = Path.domain(20);
        AbstractInterpreter<SimpleNode, String, DisjunctiveState<Path, IntervalStore>, Void>
                engine =
                        AbstractInterpreters.disjunctive(
                                domain, paths, FixpointOptions.defaults());
        InvariantMap<SimpleNode, DisjunctiveState<Path, IntervalStore>> invariants =
                engine.execProcedure(null, domain.singleton(a, i(0)), procedure);

        DisjunctiveState<Path, IntervalStore> headPre = invariants.extractPre(head);
        assertEquals(Arrays.asList(a), headPre.getDisjuncts());
        assertEquals(
                Interval.of(0, Interval.PLUS_INFINITY), headPre.getNonDisjunct().get("i"));
        assertTrue(invariants.contains(exit));
    }
}
