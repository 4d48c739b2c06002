package org.tacheck;

import org.tacheck.automata.models.SystemModel;
import org.tacheck.io.ModelLoader;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class MainTest {

    private String modelPath;

    @BeforeAll
    void setUp() throws URISyntaxException {
        modelPath = Paths.get(MainTest.class.getResource("/models/refinement.json").toURI()).toString();
        System.setProperty("tacheck.concretizeWitnesses", "false");
    }

    @AfterAll
    void tearDown() {
        System.clearProperty("tacheck.concretizeWitnesses");
    }

    @Test
    @DisplayName("参数不全时退出码为 2，--help 为 0")
    void testRun_WhenArgumentsIncomplete_ShouldPrintUsage() {
        assertAll(
                () -> assertEquals(Main.EXIT_MODEL_ERROR, Main.run(new String[0])),
                () -> assertEquals(Main.EXIT_MODEL_ERROR, Main.run(new String[]{modelPath})),
                () -> assertEquals(Main.EXIT_MODEL_ERROR, Main.run(new String[]{modelPath, "consistency: G1", "-o"})),
                () -> assertEquals(Main.EXIT_OK, Main.run(new String[]{"--help"}))
        );
    }

    @Test
    @DisplayName("所有查询成立时退出码为 0，有查询不成立时为 1")
    void testRun_ExitCodeFollowsResults() {
        assertAll(
                () -> assertEquals(Main.EXIT_OK, Main.run(new String[]{modelPath, "refinement: G1 <= G2; consistency: G1"})),
                () -> assertEquals(Main.EXIT_QUERY_FAILED, Main.run(new String[]{modelPath, "refinement: G2 <= G1"})),
                () -> assertEquals(Main.EXIT_QUERY_FAILED, Main.run(new String[]{modelPath, "refinement: G1 <="}))
        );
    }

    @Test
    @DisplayName("模型文件不存在时退出码为 2")
    void testRun_WhenModelMissing_ShouldFail(@TempDir Path dir) {
        String missing = dir.resolve("missing.json").toString();

        assertEquals(Main.EXIT_MODEL_ERROR, Main.run(new String[]{missing, "consistency: G1"}));
    }

    @Test
    @DisplayName("-o 把保存的组件写成模型文件")
    void testRun_WithOutput_ShouldWriteSavedComponents(@TempDir Path dir) throws IOException {
        // 1. 准备
        Path output = dir.resolve("saved.json");

        // 2. 执行
        int code = Main.run(new String[]{modelPath, "get-components: G1 save-as Copy", "-o", output.toString()});

        // 3. 断言
        assertEquals(Main.EXIT_OK, code);
        assertTrue(Files.exists(output));
        SystemModel saved = new ModelLoader().load(output);
        assertTrue(saved.hasComponent("Copy"));
        assertEquals(2, saved.getComponent("Copy").getLocations().size());
    }
}
