package org.modcat.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.modcat.scan.ModuleId;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.modcat.graph.GraphFixtures.graphOf;
import static org.modcat.graph.GraphFixtures.id;
import static org.modcat.graph.GraphFixtures.record;

class TopologicalOrdererTest {

    private final TopologicalOrderer orderer = new TopologicalOrderer();

    @Test
    @Tag("unit")
    void ordersLinearChain() {
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(
                record("a.py"),
                record("b.py", ".a"),
                record("c.py", ".b")));

        OrderingResult result = orderer.order(graph);

        assertThat(result.isFallback()).isFalse();
        assertThat(result.cycles()).isEmpty();
        assertThat(result.order()).containsExactly(id("a.py"), id("b.py"), id("c.py"));
    }

    @Test
    @Tag("unit")
    void independentModulesKeepDiscoveryOrder() {
        DependencyGraph graph = graphOf("c.py", "a.py", "b.py");

        assertThat(orderer.order(graph).order()).containsExactly(id("c.py"), id("a.py"), id("b.py"));
    }

    @Test
    @Tag("unit")
    void dependencyPrecedesDependentAndTiesFollowDiscovery() {
        DependencyGraph graph = graphOf("x.py", "y.py", "z.py");
        graph.addEdge(id("z.py"), id("x.py"));

        assertThat(orderer.order(graph).order()).containsExactly(id("y.py"), id("z.py"), id("x.py"));
    }

    @Test
    @Tag("unit")
    void everyEdgeIsRespectedInDiamond() {
        DependencyGraph graph = graphOf("app.py", "left.py", "right.py", "base.py");
        graph.addEdge(id("base.py"), id("left.py"));
        graph.addEdge(id("base.py"), id("right.py"));
        graph.addEdge(id("left.py"), id("app.py"));
        graph.addEdge(id("right.py"), id("app.py"));

        List<ModuleId> order = orderer.order(graph).order();

        assertThat(order).hasSize(4).doesNotHaveDuplicates();
        for (DependencyGraph.Edge edge : graph.edges()) {
            assertThat(order.indexOf(edge.dependency())).isLessThan(order.indexOf(edge.dependent()));
        }
        assertThat(order).containsExactly(id("base.py"), id("left.py"), id("right.py"), id("app.py"));
    }

    @Test
    @Tag("unit")
    void mutualImportFallsBackToDiscoveryOrder() {
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(
                record("a.py", ".b"),
                record("b.py", ".a")));

        OrderingResult result = orderer.order(graph);

        assertThat(result.isFallback()).isTrue();
        assertThat(result.order()).containsExactly(id("a.py"), id("b.py"));
        assertThat(result.cycles()).containsExactly(List.of(id("a.py"), id("b.py")));
        assertThat(OrderingResult.describe(result.cycles().get(0))).isEqualTo("a.py -> b.py -> a.py");
    }

    @Test
    @Tag("unit")
    void fallbackEmitsEveryModuleExactlyOnce() {
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(
                record("a.py", ".b"),
                record("b.py", ".c"),
                record("c.py", ".a"),
                record("d.py")));

        OrderingResult result = orderer.order(graph);

        assertThat(result.order()).containsExactly(id("a.py"), id("b.py"), id("c.py"), id("d.py"));
        assertThat(result.cycles()).containsExactly(List.of(id("a.py"), id("b.py"), id("c.py")));
    }

    @Test
    @Tag("unit")
    void reportsEachSimpleCycleOnce() {
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(
                record("a.py", ".b"),
                record("b.py", ".a", ".c"),
                record("c.py", ".b")));

        OrderingResult result = orderer.order(graph);

        assertThat(result.cycles()).containsExactlyInAnyOrder(
                List.of(id("a.py"), id("b.py")),
                List.of(id("b.py"), id("c.py")));
    }

    @Test
    @Tag("unit")
    void cycleReportingCanBeBounded() {
        DependencyGraph graph = new DependencyGraphBuilder().build(List.of(
                record("a.py", ".b"),
                record("b.py", ".a", ".c"),
                record("c.py", ".b")));

        OrderingResult result = new TopologicalOrderer(1).order(graph);

        assertThat(result.cycles()).hasSize(1);
        assertThat(result.order()).hasSize(3);
    }

    @Test
    @Tag("unit")
    void rejectsNegativeCycleBound() {
        assertThatThrownBy(() -> new TopologicalOrderer(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @Tag("unit")
    void emptyGraphYieldsEmptyOrder() {
        OrderingResult result = orderer.order(new DependencyGraph());

        assertThat(result.order()).isEmpty();
        assertThat(result.isFallback()).isFalse();
    }
}
