package org.logicflow;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口测试
 */
public class MainTest {

    @Test
    public void testDotFileName() {
        assertEquals("src_Sample_Sample_sum_int___.dot", Main.dotFileName(Path.of("src/Sample.java"), "Sample#sum(int[])"));
        assertEquals("Sample_Sample_run__.dot", Main.dotFileName(Path.of("Sample.java"), "Sample#run()"));
    }

    @Test
    public void testUniqueNameAppendsCounter() {
        Set<String> used = new HashSet<>();

        assertEquals("A_run.dot", Main.uniqueName("A_run.dot", used));
        assertEquals("A_run_2.dot", Main.uniqueName("A_run.dot", used));
        assertEquals("A_run_3.dot", Main.uniqueName("A_run.dot", used));
    }

    @Test
    public void testSameFileNameInDifferentDirectories(@TempDir Path dir) throws Exception {
        Path repo = dir.resolve("repo");
        Files.createDirectories(repo.resolve("a"));
        Files.createDirectories(repo.resolve("b"));
        Files.writeString(repo.resolve("a/Main.java"), "class Main { void run() { fromA(); } }");
        Files.writeString(repo.resolve("b/Main.java"), "class Main { void run() { fromB(); } }");
        Path dots = dir.resolve("dots");
        FlowConfig config = new FlowConfig(false, false, null, dots, null, false,
                FlowConfig.defaults().languageLevel);

        Main.run(repo, config);

        Path first = dots.resolve("a_Main_Main_run__.dot");
        Path second = dots.resolve("b_Main_Main_run__.dot");
        assertTrue(Files.readString(first, StandardCharsets.UTF_8).contains("fromA();"), "a 目录的方法单独成文件");
        assertTrue(Files.readString(second, StandardCharsets.UTF_8).contains("fromB();"), "b 目录的方法没有覆盖 a");
    }

    @Test
    public void testAnonymousClassMethodsDoNotOverwrite(@TempDir Path dir) throws Exception {
        Path source = Files.writeString(dir.resolve("Outer.java"),
                "class Outer {\n"
                        + "    Runnable r1 = new Runnable() { public void run() { one(); } };\n"
                        + "    Runnable r2 = new Runnable() { public void run() { two(); } };\n"
                        + "}\n");
        Path dots = dir.resolve("dots");
        FlowConfig config = new FlowConfig(false, false, null, dots, null, false,
                FlowConfig.defaults().languageLevel);

        Main.run(source, config);

        assertTrue(Files.readString(dots.resolve("Outer_Outer_run__.dot"), StandardCharsets.UTF_8).contains("one();"));
        assertTrue(Files.readString(dots.resolve("Outer_Outer_run___2.dot"), StandardCharsets.UTF_8).contains("two();"));
    }

    @Test
    public void testRunWritesJsonAndDot(@TempDir Path dir) throws Exception {
        Path source = Files.writeString(dir.resolve("A.java"),
                "class A {\n    void run(int x) {\n        if (x > 0) {\n            a();\n        }\n        b();\n    }\n}\n");
        Path json = dir.resolve("out.json");
        Path dots = dir.resolve("dots");
        FlowConfig config = new FlowConfig(false, false, json, dots, null, false,
                FlowConfig.defaults().languageLevel);

        Main.run(source, config);

        JsonObject root = JsonParser.parseString(Files.readString(json, StandardCharsets.UTF_8)).getAsJsonObject();
        assertEquals("file", root.get("type").getAsString());
        assertEquals("A#run(int)", root.getAsJsonArray("methods").get(0).getAsJsonObject().get("name").getAsString());

        Path dot = dots.resolve("A_A_run_int_.dot");
        assertTrue(Files.exists(dot));
        assertTrue(Files.readString(dot, StandardCharsets.UTF_8).contains("[label=\"x > 0\"]"));
    }
}
