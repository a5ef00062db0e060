package com.rapid.analyzer.graph;

import com.rapid.analyzer.core.AnalyzerConfig.DynamicDispatchMode;
import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.core.ProcedureRegistry;
import com.rapid.analyzer.scanner.RapidLineClassifier;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CallGraphBuilderTest {

    private final CallGraphBuilder allVariants =
            new CallGraphBuilder(new RapidLineClassifier(), DynamicDispatchMode.ALL_VARIANTS);
    private final CallGraphBuilder firstVariant =
            new CallGraphBuilder(new RapidLineClassifier(), DynamicDispatchMode.FIRST_VARIANT);

    private static Procedure proc(ProcedureRegistry registry, String module, String name, String... body) {
        Procedure p = new Procedure(module, Path.of(module + ".mod"), name);
        for (String line : body) {
            p.addLine(line);
        }
        registry.register(p);
        return p;
    }

    @Test
    void testStaticCallsAcrossModules() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "Cell", "Main", "  Helper;", "  rPick;");
        proc(registry, "Cell", "Helper");
        proc(registry, "Tools", "Helper");
        proc(registry, "Tools", "rPick", "  nCount := 1;");

        CallGraph graph = allVariants.build(registry);

        assertEquals(Set.of("Cell::Helper", "Tools::Helper", "Tools::rPick"), graph.callees("Cell::Main"));
        assertEquals(3, graph.edgeCount());
        assertTrue(graph.callees("Tools::rPick").isEmpty());
    }

    @Test
    void testNamesMatchCaseInsensitively() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "Cell", "Main", "  HELPER;");
        proc(registry, "Cell", "Helper");

        assertTrue(allVariants.build(registry).hasEdge("Cell::Main", "Cell::Helper"));
    }

    @Test
    void testStringsCommentsAndDisplayLinesAreNotCalls() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "Cell", "Main",
                "  rLog \"Helper\";",
                "  ! Helper",
                "  TPWrite \"Step\" \\Num:=Helper;",
                "  x := 1; ! Helper");
        proc(registry, "Cell", "Helper");

        assertTrue(allVariants.build(registry).isEmpty());
    }

    @Test
    void testSelfRecursionIsAnEdge() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "Cell", "Loop", "  Loop;");

        assertTrue(allVariants.build(registry).hasEdge("Cell::Loop", "Cell::Loop"));
    }

    @Test
    void testCallByVarAllVariants() {
        ProcedureRegistry registry = stationRegistry();

        CallGraph graph = allVariants.build(registry);

        assertEquals(Set.of("Line1::Station_1", "Line1::Station_2", "Line2::Station_2"),
                graph.callees("Cell::Main"));
    }

    @Test
    void testCallByVarFirstVariant() {
        ProcedureRegistry registry = stationRegistry();

        CallGraph graph = firstVariant.build(registry);

        assertEquals(Set.of("Line1::Station_1"), graph.callees("Cell::Main"));
    }

    @Test
    void testFirstVariantNeverWidensTheSet() {
        ProcedureRegistry registry = stationRegistry();
        for (String prefix : List.of("station_", "station_2", "STATION", "nothing", "s")) {
            Set<String> all = allVariants.resolveDynamic(prefix, registry);
            Set<String> first = firstVariant.resolveDynamic(prefix, registry);
            assertTrue(first.size() <= 1, "First variant resolves to at most one target for " + prefix);
            assertTrue(all.containsAll(first), "First variant is one of all variants for " + prefix);
        }
    }

    @Test
    void testFirstVariantPicksFirstModule() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "ZModule", "Cycle_A");
        proc(registry, "AModule", "Cycle_A");

        assertEquals(Set.of("AModule::Cycle_A"), firstVariant.resolveDynamic("cycle_", registry));
    }

    @Test
    void testUnmatchedPrefixAddsNothing() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "Cell", "Main", "  CallByVar \"Missing_\", n;");

        assertTrue(allVariants.build(registry).isEmpty());
    }

    private static ProcedureRegistry stationRegistry() {
        ProcedureRegistry registry = new ProcedureRegistry();
        proc(registry, "Cell", "Main", "  CallByVar \"Station_\", nStation;");
        proc(registry, "Line1", "Station_1");
        proc(registry, "Line1", "Station_2");
        proc(registry, "Line2", "Station_2");
        proc(registry, "Line2", "Other");
        return registry;
    }
}
