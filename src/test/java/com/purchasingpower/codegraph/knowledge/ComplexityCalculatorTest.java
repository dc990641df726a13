package com.purchasingpower.codegraph.knowledge;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.MethodDeclaration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("Complexity Calculator Tests")
class ComplexityCalculatorTest {

    @Test
    @DisplayName("Straight-line method scores the base complexity")
    void straightLineMethod() {
        assertEquals(1, complexityOf("int run(int a) { int b = a + 1; return b * 2; }"));
    }

    @Test
    @DisplayName("Two ifs and one && score four")
    void ifsAndLogicalAnd() {
        String method = """
            int run(int a, int b) {
                if (a > 0) {
                    return 1;
                }
                if (a > b && b > 0) {
                    return 2;
                }
                return 0;
            }
            """;
        assertEquals(4, complexityOf(method));
    }

    @Test
    @DisplayName("Chained && counts each binary expression")
    void chainedLogicalOperators() {
        assertEquals(3, complexityOf("boolean run(boolean a, boolean b, boolean c) { return a && b && c; }"));
    }

    @Test
    @DisplayName("Loops, ternary and catch each add one")
    void loopsTernaryAndCatch() {
        String method = """
            int run(int[] values) {
                int total = 0;
                for (int i = 0; i < values.length; i++) { total += i; }
                for (int v : values) { total += v; }
                while (total > 100) { total--; }
                do { total++; } while (total < 0);
                try {
                    total = total > 5 ? total : 5;
                } catch (IllegalStateException e) {
                    total = 0;
                }
                return total;
            }
            """;
        assertEquals(7, complexityOf(method));
    }

    @Test
    @DisplayName("Case labels count, default does not")
    void switchEntries() {
        String method = """
            String run(int code) {
                switch (code) {
                    case 1: return "one";
                    case 2: return "two";
                    default: return "many";
                }
            }
            """;
        assertEquals(3, complexityOf(method));
    }

    private static int complexityOf(String method) {
        CompilationUnit cu = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17))
            .parse("class Sample { " + method + " }")
            .getResult()
            .orElseThrow();
        MethodDeclaration declaration = cu.findFirst(MethodDeclaration.class).orElseThrow();
        return ComplexityCalculator.calculate(declaration);
    }
}
