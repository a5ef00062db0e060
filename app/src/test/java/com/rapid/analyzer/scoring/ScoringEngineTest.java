package com.rapid.analyzer.scoring;

import com.rapid.analyzer.core.AnalyzerConfig;
import com.rapid.analyzer.core.FileMetrics;
import com.rapid.analyzer.core.FileScoreRecord;
import com.rapid.analyzer.core.Procedure;
import com.rapid.analyzer.graph.DepthMap;
import com.rapid.analyzer.naming.NamingScorer;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class ScoringEngineTest {

    private static final Path FILE = Path.of("Cell.mod");
    private static final Set<String> WORDS = Set.of("count", "speed", "gripper", "used", "shared");

    private final ScoringEngine engine = new ScoringEngine(AnalyzerConfig.defaults(), new NamingScorer(WORDS::contains));

    private static FileMetrics metrics(int total, int code, int comments, int simple, int nesting,
                                       Set<String> declared, Set<String> variables) {
        return new FileMetrics(FILE, total, code, comments, simple, simple, nesting,
                nesting > 0 ? 1 : null, null, 0, 0.0,
                variables, declared, Set.of(), Set.of(), List.of(), List.of());
    }

    private static FileMetrics metrics(int total, int code, int comments, int simple, int nesting) {
        return metrics(total, code, comments, simple, nesting, Set.of(), Set.of());
    }

    private static Procedure proc(String name, int lines) {
        Procedure p = new Procedure("Cell", FILE, name);
        for (int i = 0; i < lines; i++) {
            p.addLine("  x;");
        }
        return p;
    }

    private static FileScoreRecord withScore(double score) {
        return new FileScoreRecord(metrics(10, 10, 0, 1, 0), 0, 0, 1, List.of(), 0, 0, 0, 0,
                Map.of(), List.of(), List.of(), Penalties.none(), score);
    }

    @Test
    void testCommentHealthAnchors() {
        assertEquals(0.0, ScoringEngine.commentHealth(0.0));
        assertEquals(0.5, ScoringEngine.commentHealth(0.03), 1e-9);
        assertEquals(1.0, ScoringEngine.commentHealth(0.06), 1e-9);
        assertEquals(1.0, ScoringEngine.commentHealth(0.15));
        assertEquals(1.0, ScoringEngine.commentHealth(0.25));
        assertEquals(0.5, ScoringEngine.commentHealth(0.425), 1e-9);
        assertEquals(0.0, ScoringEngine.commentHealth(0.60));
        assertEquals(0.0, ScoringEngine.commentHealth(0.9));
    }

    @Test
    void testCommentHealthShape() {
        double previous = 0.0;
        for (double r = 0.0; r <= 0.06; r += 0.005) {
            double h = ScoringEngine.commentHealth(r);
            assertTrue(h >= previous - 1e-12, "Health should not fall while ramping up at " + r);
            previous = h;
        }
        previous = 1.0;
        for (double r = 0.25; r <= 1.0; r += 0.01) {
            double h = ScoringEngine.commentHealth(r);
            assertTrue(h <= previous + 1e-12, "Health should not rise past the plateau at " + r);
            assertTrue(h >= 0.0 && h <= 1.0);
            previous = h;
        }
    }

    @Test
    void testCleanFileScoresFull() {
        FileScoreRecord r = engine.score(metrics(100, 90, 10, 5, 2), List.of(), DepthMap.empty(), Set.of(), Set.of());

        assertEquals(100.0, r.score(), 1e-9);
        assertEquals(0.1, r.commentRatio(), 1e-9);
        assertEquals(1.0, r.namingScore());
        assertEquals(0.0, r.penalties().total(), 1e-9);
    }

    @Test
    void testNoCommentsCostsFivePoints() {
        FileScoreRecord r = engine.score(metrics(100, 100, 0, 5, 2), List.of(), DepthMap.empty(), Set.of(), Set.of());

        assertEquals(5.0, r.penalties().comments(), 1e-9);
        assertEquals(95.0, r.score(), 1e-9);
    }

    @Test
    void testEmptyFileDoesNotDivideByZero() {
        FileScoreRecord r = engine.score(metrics(0, 0, 0, 1, 0), List.of(), DepthMap.empty(), Set.of(), Set.of());

        assertEquals(0.0, r.commentRatio());
        assertEquals(0.0, r.biggestProcedureRatio());
        assertEquals(95.0, r.score(), 1e-9);
    }

    @Test
    void testScoreClampedAtZero() {
        List<Procedure> procedures = new ArrayList<>();
        Map<String, Integer> depths = new HashMap<>();
        for (int i = 0; i <= 10; i++) {
            Procedure p = proc(i == 0 ? "Main" : "P" + i, 1);
            procedures.add(p);
            depths.put(p.qualifiedName(), i);
        }
        Set<String> declared = new HashSet<>();
        for (int i = 0; i < 40; i++) {
            declared.add("nVar" + i);
        }

        FileScoreRecord r = engine.score(metrics(100, 100, 0, 500, 50, declared, Set.of()),
                procedures, DepthMap.of(depths), Set.of(), Set.of());

        assertEquals(10, r.maxCallDepth());
        assertEquals(50.0, r.penalties().callDepth(), 1e-9);
        assertEquals(30.0, r.penalties().complexity(), 1e-9);
        assertEquals(30.0, r.penalties().nesting(), 1e-9);
        assertEquals(20.0, r.penalties().unusedVariables(), 1e-9);
        assertEquals(0.0, r.score());
    }

    @Test
    void testIndividualPenalties() {
        FileMetrics m = metrics(100, 100, 10, 60, 10);

        Penalties p = engine.penalties(m, 25, 0.1, 4, 10, 41, 0.5);

        assertEquals(10.0, p.complexity(), 1e-9);
        assertEquals(10.0, p.nesting(), 1e-9);
        assertEquals(15.0, p.callDepth(), 1e-9);
        assertEquals(5.0, p.procedureCount(), 1e-9);
        assertEquals(0.0, p.procedureSize(), 1e-9);
        assertEquals(0.0, p.fileSize(), 1e-9);
        assertEquals(5.0, p.unusedVariables(), 1e-9);
        assertEquals(20.0, p.badWords(), 1e-9);
        assertEquals(2.5, p.comments(), 1e-9);
    }

    @Test
    void testPenaltiesAtThresholdsAreZero() {
        Penalties p = engine.penalties(metrics(300, 300, 30, 50, 8), 20, 0.6, 3, 0, 0, 1.0);
        assertEquals(0.0, p.total(), 1e-9);
    }

    @Test
    void testPenaltyCaps() {
        Penalties p = engine.penalties(metrics(1200, 1200, 100, 1000, 40), 500, 0.1, 99, 1000, 1000, 1.0);

        assertEquals(30.0, p.complexity(), 1e-9);
        assertEquals(30.0, p.nesting(), 1e-9);
        assertEquals(50.0, p.callDepth(), 1e-9);
        assertEquals(20.0, p.procedureCount(), 1e-9);
        assertEquals(20.0, p.fileSize(), 1e-9);
        assertEquals(20.0, p.unusedVariables(), 1e-9);
        assertEquals(20.0, p.badWords(), 1e-9);
    }

    @Test
    void testProcedureSizeNeedsBigFile() {
        assertEquals(10.0, engine.penalties(metrics(301, 301, 30, 1, 0), 1, 0.8, 0, 0, 0, 1.0).procedureSize(), 1e-9);
        assertEquals(0.0, engine.penalties(metrics(300, 300, 30, 1, 0), 1, 0.8, 0, 0, 0, 1.0).procedureSize(), 1e-9);
    }

    @Test
    void testFileSizeNeedsSeveralProcedures() {
        assertEquals(5.0, engine.penalties(metrics(700, 700, 70, 1, 0), 2, 0.1, 0, 0, 0, 1.0).fileSize(), 1e-9);
        assertEquals(0.0, engine.penalties(metrics(700, 700, 70, 1, 0), 1, 0.1, 0, 0, 0, 1.0).fileSize(), 1e-9);
    }

    @Test
    void testReachabilityClassification() {
        Procedure main = proc("Main", 2);
        Procedure station = proc("Station_1", 3);
        Procedure helper = proc("Helper", 4);
        Procedure orphan = proc("Orphan", 1);
        DepthMap depths = DepthMap.of(Map.of("Cell::Helper", 1));

        FileScoreRecord r = engine.score(metrics(20, 10, 2, 1, 0),
                List.of(main, station, helper, orphan), depths, Set.of("station_"), Set.of());

        assertEquals(Reachability.MAIN, r.procedureReachability().get("Cell::Main"));
        assertEquals(Reachability.DYNAMIC, r.procedureReachability().get("Cell::Station_1"));
        assertEquals(Reachability.REACHABLE, r.procedureReachability().get("Cell::Helper"));
        assertEquals(Reachability.UNREACHABLE, r.procedureReachability().get("Cell::Orphan"));
        assertEquals(List.of("Orphan"), r.unreachableProcedures());
        assertEquals(1, r.maxCallDepth());
        assertEquals(4, r.procedureCount());
        assertEquals(4, r.biggestProcedureLines());
        assertEquals(0.4, r.biggestProcedureRatio(), 1e-9);
    }

    @Test
    void testBiggestRatioFallsBackToProcedureLines() {
        FileScoreRecord r = engine.score(metrics(0, 0, 0, 1, 0),
                List.of(proc("A", 3), proc("B", 1)), DepthMap.empty(), Set.of(), Set.of());
        assertEquals(0.75, r.biggestProcedureRatio(), 1e-9);
    }

    @Test
    void testUnusedVariablesUseProjectReferences() {
        FileMetrics m = metrics(10, 9, 1, 1, 0, Set.of("nUsed", "nShared", "nUnused"), Set.of("nUsed", "nShared", "nUnused"));

        FileScoreRecord r = engine.score(m, List.of(), DepthMap.empty(), Set.of(), Set.of("nUsed", "nShared"));

        assertEquals(List.of("nUnused"), r.unusedVariables());
        assertEquals(0.5, r.penalties().unusedVariables(), 1e-9);
    }

    @Test
    void testUnusedVariableMatchIsCaseSensitive() {
        FileMetrics m = metrics(10, 9, 1, 1, 0, Set.of("nCount"), Set.of("nCount"));

        FileScoreRecord r = engine.score(m, List.of(), DepthMap.empty(), Set.of(), Set.of("NCOUNT"));

        assertEquals(List.of("nCount"), r.unusedVariables());
    }

    @Test
    void testBadWordsPenalized() {
        FileMetrics m = metrics(10, 9, 1, 1, 0, Set.of(), Set.of("nCount", "qzFoo"));

        FileScoreRecord r = engine.score(m, List.of(), DepthMap.empty(), Set.of(), Set.of());

        assertEquals(List.of("foo", "qz"), r.badTokens());
        assertEquals(0.5, r.namingScore(), 1e-9);
        assertEquals(1.0, r.penalties().badWords(), 1e-9);
    }

    @Test
    void testProjectScore() {
        assertEquals(0.0, engine.projectScore(List.of()));
        assertEquals(90.0, engine.projectScore(List.of(withScore(90))), 1e-9);
        assertEquals(75.0, engine.projectScore(List.of(withScore(50), withScore(100))), 1e-9);

        // mean 65.7, worst three mean 20 + 40 margin
        List<FileScoreRecord> files = List.of(withScore(100), withScore(100), withScore(100), withScore(100),
                withScore(10), withScore(20), withScore(30));
        assertEquals(60.0, engine.projectScore(files), 1e-9);
    }

    @Test
    void testProjectScoreNeverAboveMean() {
        List<FileScoreRecord> files = List.of(withScore(80), withScore(70), withScore(60), withScore(90));
        assertEquals(75.0, engine.projectScore(files), 1e-9);
    }

    @Test
    void testPenaltyRule() {
        PenaltyRule rule = PenaltyRule.capped(10, 2, 15);
        assertEquals(0.0, rule.apply(5));
        assertEquals(4.0, rule.apply(12));
        assertEquals(15.0, rule.apply(100));
        assertTrue(rule.isCapped());

        PenaltyRule open = PenaltyRule.uncapped(0.6, 50);
        assertFalse(open.isCapped());
        assertEquals(20.0, open.apply(1.0), 1e-9);
    }
}
