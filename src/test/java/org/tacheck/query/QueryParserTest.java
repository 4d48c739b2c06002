package org.tacheck.query;

import org.tacheck.exceptions.QueryParseException;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class QueryParserTest {

    @Nested
    @DisplayName("查询种类")
    class KindTests {

        @Test
        @DisplayName("精化查询的两侧都是系统表达式")
        void testParse_Refinement_ShouldHaveTwoSystems() {
            Query query = QueryParser.parse("refinement: A && B <= C");

            assertAll(
                    () -> assertEquals(QueryKind.REFINEMENT, query.getKind()),
                    () -> assertEquals(2, query.getSystems().size()),
                    () -> assertEquals("(A && B)", query.getSystems().get(0).toString()),
                    () -> assertEquals("C", query.getSystems().get(1).toString()),
                    () -> assertEquals("refinement: A && B <= C", query.getText())
            );
        }

        @Test
        @DisplayName("一致性与确定性查询")
        void testParse_ConsistencyAndDeterminism() {
            assertEquals(QueryKind.CONSISTENCY, QueryParser.parse("consistency: A").getKind());
            assertEquals(QueryKind.DETERMINISM, QueryParser.parse("determinism: (A // B)").getKind());
        }

        @Test
        @DisplayName("get-components 与 prune 需要 save-as")
        void testParse_SaveAs_ShouldCaptureName() {
            Query get = QueryParser.parse("get-components: A && B save-as AB");
            Query alias = QueryParser.parse("get-component: A save-as Copy");
            Query prune = QueryParser.parse("prune: A && B save-as P");

            assertAll(
                    () -> assertEquals(QueryKind.GET_COMPONENTS, get.getKind()),
                    () -> assertEquals("AB", get.getSaveAs()),
                    () -> assertEquals(QueryKind.GET_COMPONENTS, alias.getKind()),
                    () -> assertEquals("Copy", alias.getSaveAs()),
                    () -> assertEquals(QueryKind.PRUNE, prune.getKind()),
                    () -> assertEquals("P", prune.getSaveAs())
            );
        }
    }

    @Nested
    @DisplayName("系统表达式的优先级")
    class PrecedenceTests {

        @Test
        @DisplayName("&& 优先于 //，// 优先于 \\\\")
        void testParse_ShouldRespectPrecedence() {
            Query query = QueryParser.parse("consistency: A \\\\ B // C && D");

            assertEquals("(A \\\\ (B // (C && D)))", query.getSystems().get(0).toString());
        }

        @Test
        @DisplayName("括号改变结合，|| 与单个反斜杠是等价写法")
        void testParse_AlternativeOperators() {
            Query parenthesised = QueryParser.parse("consistency: (A \\ B) || C");
            Query chained = QueryParser.parse("consistency: A && B && C");

            assertAll(
                    () -> assertEquals("((A \\\\ B) // C)", parenthesised.getSystems().get(0).toString()),
                    () -> assertEquals("((A && B) && C)", chained.getSystems().get(0).toString()),
                    () -> assertEquals(List.of("A", "B", "C"), chained.getSystems().get(0).componentNames())
            );
        }
    }

    @Nested
    @DisplayName("可达性查询")
    class ReachabilityTests {

        @Test
        @DisplayName("简写 C.L 从初始状态出发")
        void testParse_Shorthand_ShouldTargetLocation() {
            Query query = QueryParser.parse("reachability: M.L5");

            assertAll(
                    () -> assertEquals(QueryKind.REACHABILITY, query.getKind()),
                    () -> assertNull(query.getStart()),
                    () -> assertEquals("M", query.getSystems().get(0).toString()),
                    () -> assertEquals(1, query.getTarget().locationAtoms().size())
            );
        }

        @Test
        @DisplayName("起始谓词与目标谓词，包括差分约束与负常量")
        void testParse_FullForm_ShouldParsePredicates() {
            Query query = QueryParser.parse(
                    "reachability: A // B @ A.L0 && B.L0 && A.x <= 3 -> (A.L2 || B.L1) && A.x - B.y > -2");

            assertAll(
                    () -> assertNotNull(query.getStart()),
                    () -> assertEquals(2, query.getStart().locationAtoms().size()),
                    () -> assertEquals(1, query.getStart().clockConstraints().size()),
                    () -> assertEquals(2, query.getTarget().locationAtoms().size()),
                    () -> assertEquals("x - y > -2", query.getTarget().clockConstraints().get(0).toString())
            );
        }

        @Test
        @DisplayName("true 作为目标")
        void testParse_TrueTarget() {
            Query query = QueryParser.parse("reachability: A -> true");

            assertTrue(query.getTarget().locationAtoms().isEmpty());
            assertTrue(query.getTarget().clockConstraints().isEmpty());
        }
    }

    @Nested
    @DisplayName("查询列表")
    class SplitTests {

        @Test
        @DisplayName("按分号切分，跳过空段并记录偏移")
        void testSplit_ShouldSkipBlankSegments() {
            List<QueryParser.Segment> segments = QueryParser.split("consistency: A;  ; determinism: B;");

            assertAll(
                    () -> assertEquals(2, segments.size()),
                    () -> assertEquals("consistency: A", segments.get(0).toString()),
                    () -> assertEquals("determinism: B", segments.get(1).toString()),
                    () -> assertEquals(18, segments.get(1).getOffset())
            );
        }

        @Test
        @DisplayName("parseAll 依次解析每一段")
        void testParseAll() {
            List<Query> queries = QueryParser.parseAll("refinement: A <= B; consistency: A");

            assertEquals(List.of(QueryKind.REFINEMENT, QueryKind.CONSISTENCY),
                    List.of(queries.get(0).getKind(), queries.get(1).getKind()));
        }
    }

    @Nested
    @DisplayName("语法错误")
    class ErrorTests {

        @Test
        @DisplayName("未知的查询种类")
        void testParse_WhenKindUnknown_ShouldReportPosition() {
            QueryParseException e = assertThrows(QueryParseException.class, () -> QueryParser.parse("bogus: A"));

            assertEquals(0, e.getPosition());
            assertTrue(e.getMessage().contains("bogus"));
        }

        @Test
        @DisplayName("缺少冒号时报告下一个记号的位置")
        void testParse_WhenColonMissing_ShouldReportPosition() {
            QueryParseException e = assertThrows(QueryParseException.class, () -> QueryParser.parse("consistency A"));

            assertEquals(12, e.getPosition());
            assertTrue(e.getMessage().endsWith("(at position 12)"));
        }

        @Test
        @DisplayName("查询末尾的多余内容")
        void testParse_WhenTrailingTokens_ShouldFail() {
            QueryParseException e = assertThrows(QueryParseException.class,
                    () -> QueryParser.parse("consistency: A B"));

            assertEquals(15, e.getPosition());
        }

        @Test
        @DisplayName("缺少 save-as")
        void testParse_WhenSaveAsMissing_ShouldFail() {
            assertThrows(QueryParseException.class, () -> QueryParser.parse("get-components: A"));
            assertThrows(QueryParseException.class, () -> QueryParser.parse("prune: A save B"));
        }

        @Test
        @DisplayName("无法识别的字符与未闭合的括号")
        void testParse_WhenMalformed_ShouldFail() {
            assertAll(
                    () -> assertThrows(QueryParseException.class, () -> QueryParser.parse("consistency: A $ B")),
                    () -> assertThrows(QueryParseException.class, () -> QueryParser.parse("consistency: (A && B")),
                    () -> assertThrows(QueryParseException.class, () -> QueryParser.parse("refinement: A")),
                    () -> assertThrows(QueryParseException.class, () -> QueryParser.parse("reachability: A -> A.x <")),
                    () -> assertThrows(QueryParseException.class, () -> QueryParser.parse(""))
            );
        }

        @Test
        @DisplayName("列表中第二段的错误位置是整个输入中的偏移")
        void testParseAll_WhenSecondSegmentInvalid_ShouldReportAbsolutePosition() {
            QueryParseException e = assertThrows(QueryParseException.class,
                    () -> QueryParser.parseAll("consistency: A; consistency B"));

            assertEquals(28, e.getPosition());
        }
    }
}
