package org.sourcerange;

import org.sourcerange.api.Range;
import org.sourcerange.api.RangeOptions;
import org.sourcerange.ast.Block;
import org.sourcerange.ast.Call;
import org.sourcerange.ast.Dot;
import org.sourcerange.ast.DotCall;
import org.sourcerange.ast.Metadata;
import org.sourcerange.ast.ModuleRef;
import org.sourcerange.ast.Node;
import org.sourcerange.ast.NodeList;
import org.sourcerange.ast.Pair;
import org.sourcerange.ast.Sigil;
import org.sourcerange.ast.Text;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.sourcerange.testutils.Nodes.alias;
import static org.sourcerange.testutils.Nodes.atom;
import static org.sourcerange.testutils.Nodes.interpolation;
import static org.sourcerange.testutils.Nodes.number;
import static org.sourcerange.testutils.Nodes.op;
import static org.sourcerange.testutils.Nodes.segments;
import static org.sourcerange.testutils.Nodes.string;
import static org.sourcerange.testutils.Nodes.text;
import static org.sourcerange.testutils.Nodes.var;

/**
 * Checks properties that must hold for every node of a tree: the range is well ordered, it
 * contains the ranges of all children, and slicing the source with it yields exactly the node's
 * text. The trees are built by hand for the source snippets below, as the parser would.
 */
@Tag("unit")
class RangePropertiesTest {

    private final RangeEngine engine = new RangeEngine();

    @Test
    void callWithNestedOperator() {
        String source = "foo(1, bar + 2)";
        Call plus = op("+", 1, 12, var("bar", 1, 8), number(1, 14, "2"));
        Call foo = new Call(Metadata.builder().at(1, 1).closing(1, 15).build(), "foo", List.of(number(1, 5, "1"), plus));

        assertRoundTrip(source, foo, source);
        assertRoundTrip(source, plus, "bar + 2");
        assertContainment(foo);
    }

    @Test
    void accessOnQualifiedCall() {
        String source = "Foo.Bar.baz(x)[:key]";
        DotCall baz = new DotCall(Metadata.builder().at(1, 9).closing(1, 14).build(),
                new Dot(Metadata.at(1, 8), alias(1, 1, "Foo", "Bar"), "baz"), List.of(var("x", 1, 13)));
        DotCall access = new DotCall(Metadata.builder().at(1, 15).closing(1, 20).build(),
                new Dot(Metadata.at(1, 15), new ModuleRef("Access"), "get"), List.of(baz, atom("key", 1, 16)));

        assertRoundTrip(source, access, source);
        assertRoundTrip(source, baz, "Foo.Bar.baz(x)");
        assertRoundTrip(source, baz.dot().receiver(), "Foo.Bar");
        assertContainment(access);
    }

    @Test
    void keywordListLiteral() {
        String source = "[a: 1, b: :c]";
        NodeList pairs = NodeList.of(
                new Pair(atom("a", 1, 2), number(1, 5, "1")),
                new Pair(atom("b", 1, 8), atom("c", 1, 11)));
        Block list = new Block(Metadata.builder().at(1, 1).closing(1, 13).build(), List.of(pairs));

        assertRoundTrip(source, list, source);
        assertRoundTrip(source, pairs, "a: 1, b: :c");
        assertRoundTrip(source, pairs.elements().get(1), "b: :c");
        assertContainment(list);
    }

    @Test
    void anonymousFunction() {
        String source = "fn x -> x * 2 end";
        Call stab = op("->", 1, 6, NodeList.of(var("x", 1, 4)), op("*", 1, 11, var("x", 1, 9), number(1, 13, "2")));
        Call fn = new Call(Metadata.builder().at(1, 1).end(1, 15).build(), "fn", List.of(stab));

        assertRoundTrip(source, fn, source);
        assertRoundTrip(source, stab, "x -> x * 2");
        assertContainment(fn);
    }

    @Test
    void concatenationOfInterpolatedString() {
        String source = "\"a#{b}c\" <> \"d\"";
        Call interpolated = segments(1, 1, "\"", text("a"), interpolation(var("b", 1, 5), 1, 3, 1, 6), text("c"));
        Call concat = op("<>", 1, 10, interpolated, string("d", "\"", 1, 13));

        assertRoundTrip(source, concat, source);
        assertRoundTrip(source, interpolated, "\"a#{b}c\"");
        assertContainment(concat);
    }

    @Test
    void multiLineSource() {
        String source = String.join("\n",
                "x = ~r/ab+/i",
                "\"\"\"",
                "hello",
                "\"\"\"",
                "alias Foo.{A, B}",
                "if x do",
                "  :ok",
                "end");
        Sigil regex = new Sigil(Metadata.builder().at(1, 5).delimiter("/").build(), "r",
                segments(1, 5, null, text("ab+")), "i");
        Call match = op("=", 1, 3, var("x", 1, 1), regex);
        Node heredoc = string("hello\n", "\"\"\"", 2, 1);
        DotCall tuple = new DotCall(Metadata.builder().at(5, 10).closing(5, 16).build(),
                new Dot(Metadata.at(5, 10), alias(5, 7, "Foo"), "{}"), List.of(alias(5, 12, "A"), alias(5, 15, "B")));
        Call aliasCall = op("alias", 5, 1, tuple);
        Call ifCall = new Call(Metadata.builder().at(6, 1).end(8, 1).build(), "if",
                List.of(var("x", 6, 4), NodeList.of(new Pair(atom("do", 6, 6), atom("ok", 7, 3)))));

        List<Node> topLevel = List.of(match, heredoc, aliasCall, ifCall);
        List<Range> ranges = engine.getRanges(topLevel, RangeOptions.defaults());

        assertThat(ranges.get(0).slice(source)).isEqualTo("x = ~r/ab+/i");
        assertThat(ranges.get(1).slice(source)).isEqualTo("\"\"\"\nhello\n\"\"\"");
        assertThat(ranges.get(2).slice(source)).isEqualTo("alias Foo.{A, B}");
        assertThat(ranges.get(3).slice(source)).isEqualTo("if x do\n  :ok\nend");
        assertRoundTrip(source, tuple, "Foo.{A, B}");
        assertRoundTrip(source, regex, "~r/ab+/i");
        for (Node node : topLevel) {
            assertContainment(node);
        }
    }

    @Test
    void oneEngineServesManyThreads() throws Exception {
        List<Node> nodes = new ArrayList<>();
        for (int line = 1; line <= 200; line++) {
            nodes.add(op("+", line, 3, var("a", line, 1), op("*", line, 7, var("b", line, 5), number(line, 9, "42"))));
        }
        List<Range> expected = engine.getRanges(nodes, RangeOptions.defaults());

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<Range>> tasks = new ArrayList<>();
            for (Node node : nodes) {
                tasks.add(() -> engine.getRange(node));
            }
            List<Future<Range>> futures = executor.invokeAll(tasks);
            for (int i = 0; i < futures.size(); i++) {
                assertThat(futures.get(i).get()).isEqualTo(expected.get(i));
                assertThat(futures.get(i).get()).isEqualTo(Range.of(i + 1, 1, i + 1, 11));
            }
        } finally {
            executor.shutdown();
            assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    private void assertRoundTrip(String source, Node node, String expectedText) {
        Range range = engine.getRange(node);
        assertThat(range.start()).isLessThanOrEqualTo(range.end());
        assertThat(range.slice(source)).as("text of %s", node.describe()).isEqualTo(expectedText);
    }

    /**
     * Walks the tree and checks that every node's range contains the ranges of its children.
     * Interpolation bodies, raw segments and dots are not spanned on their own.
     */
    private void assertContainment(Node node) {
        Range range = engine.getRange(node);
        assertThat(range.start()).isLessThanOrEqualTo(range.end());
        for (Node child : spannedChildren(node)) {
            Range childRange = engine.getRange(child);
            assertThat(range.contains(childRange))
                    .as("%s %s contains %s %s", node.describe(), range, child.describe(), childRange)
                    .isTrue();
            assertContainment(child);
        }
    }

    private List<Node> spannedChildren(Node node) {
        if (node instanceof Call call && "<<>>".equals(call.name()) && call.meta().delimiter() != null) {
            return List.of();
        }
        if (node instanceof Sigil) {
            return List.of();
        }
        List<Node> children = new ArrayList<>();
        for (Node child : node.getChildren()) {
            if (child instanceof Dot dot) {
                if (!(dot.receiver() instanceof ModuleRef)) {
                    children.add(dot.receiver());
                }
            } else if (!(child instanceof Text) && !(child instanceof ModuleRef)) {
                children.add(child);
            }
        }
        return children;
    }
}
