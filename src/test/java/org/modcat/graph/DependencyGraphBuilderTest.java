package org.modcat.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.modcat.graph.GraphFixtures.id;
import static org.modcat.graph.GraphFixtures.record;

class DependencyGraphBuilderTest {

    private final DependencyGraphBuilder builder = new DependencyGraphBuilder();

    @Test
    @Tag("unit")
    void resolvesSiblingRelativeImportsAtRootLevel() {
        DependencyGraph graph = builder.build(List.of(
                record("a.py"),
                record("b.py", ".a"),
                record("c.py", ".b")));

        assertThat(graph.hasEdge(id("a.py"), id("b.py"))).isTrue();
        assertThat(graph.hasEdge(id("b.py"), id("c.py"))).isTrue();
        assertThat(graph.edgeCount()).isEqualTo(2);
    }

    @Test
    @Tag("unit")
    void extraDotsAscendPackageLevels() {
        DependencyGraph graph = builder.build(List.of(
                record("pkg/util.py"),
                record("pkg/sub/mod.py", "..util")));

        assertThat(graph.hasEdge(id("pkg/util.py"), id("pkg/sub/mod.py"))).isTrue();
    }

    @Test
    @Tag("unit")
    void relativeImportAboveRootIsDropped() {
        DependencyGraph graph = builder.build(List.of(
                record("x.py"),
                record("pkg/mod.py", "...x"),
                record("top.py", "..x")));

        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    @Tag("unit")
    void fallsBackToPackageIndex() {
        DependencyGraph graph = builder.build(List.of(
                record("pkg/__init__.py"),
                record("pkg/sub/__init__.py"),
                record("pkg/a.py", ".sub"),
                record("pkg/b.py", ".")));

        assertThat(graph.hasEdge(id("pkg/sub/__init__.py"), id("pkg/a.py"))).isTrue();
        assertThat(graph.hasEdge(id("pkg/__init__.py"), id("pkg/b.py"))).isTrue();
    }

    @Test
    @Tag("unit")
    void absoluteImportsMatchWholePathSegments() {
        DependencyGraph graph = builder.build(List.of(
                record("util.py"),
                record("myutil.py"),
                record("pkg/util.py"),
                record("vendor/pkg/util.py"),
                record("main.py", "util", "pkg.util", "os")));

        assertThat(graph.dependenciesOf(id("main.py"))).containsExactlyInAnyOrder(
                id("util.py"), id("pkg/util.py"), id("vendor/pkg/util.py"));
    }

    @Test
    @Tag("unit")
    void selfImportsAddNoEdge() {
        DependencyGraph graph = builder.build(List.of(record("a.py", "a", ".a")));

        assertThat(graph.edgeCount()).isZero();
    }

    @Test
    @Tag("unit")
    void repeatedImportsOfTheSameModuleYieldOneEdge() {
        DependencyGraph graph = builder.build(List.of(
                record("a.py"),
                record("b.py", ".a", "a")));

        assertThat(graph.edgeCount()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void honoursConfiguredExtensions() {
        DependencyGraphBuilder pyi = new DependencyGraphBuilder(List.of(".pyi"));
        DependencyGraph graph = pyi.build(List.of(
                record("stubs/api.pyi"),
                record("client.pyi", "stubs.api")));

        assertThat(graph.hasEdge(id("stubs/api.pyi"), id("client.pyi"))).isTrue();
    }
}
