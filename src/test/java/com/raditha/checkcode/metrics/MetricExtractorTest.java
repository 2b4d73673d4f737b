package com.raditha.checkcode.metrics;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.raditha.checkcode.model.Metrics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetricExtractor.
 */
class MetricExtractorTest {

    private final MetricExtractor extractor = new MetricExtractor();

    private static CompilationUnit parse(String code) {
        JavaParser parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17));
        return parser.parse(code).getResult().orElseThrow();
    }

    private static MethodDeclaration method(String code) {
        return parse(code).findFirst(MethodDeclaration.class).orElseThrow();
    }

    @Test
    void testStraightLineMethodHasComplexityOne() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    int id(int x) {
                        return x;
                    }
                }
                """));

        assertEquals(1, metrics.cyclomaticComplexity());
        assertEquals(3, metrics.lines());
        // own header + return
        assertEquals(2, metrics.statements());
        assertEquals(1, metrics.expressions());
        assertEquals(1, metrics.parameters());
        assertNull(metrics.duplication());
    }

    @Test
    void testSingleIf() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    int f(int x) {
                        if (x > 0) {
                            return 1;
                        }
                        return 0;
                    }
                }
                """));

        assertEquals(2, metrics.cyclomaticComplexity());
        assertEquals(6, metrics.lines());
        assertEquals(4, metrics.statements());
        // x > 0, x, 0, 1, 0
        assertEquals(5, metrics.expressions());
        assertEquals(0, metrics.expressionStatements());
    }

    @Test
    void testEachDecisionAddsOne() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    void f(int[] xs, boolean a, boolean b) {
                        for (int i = 0; i < xs.length; i++) {
                            while (a && b) {
                                a = false;
                            }
                        }
                        for (int x : xs) {
                            do {
                                x--;
                            } while (x > 0 || a);
                        }
                        try {
                            System.out.println(xs.length);
                        } catch (RuntimeException e) {
                            throw e;
                        }
                    }
                }
                """));

        // for, while, &&, for-each, do, ||, try, catch
        assertEquals(9, metrics.cyclomaticComplexity());
        assertEquals(3, metrics.parameters());
    }

    @Test
    void testSwitchAndTernary() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    String f(int x) {
                        switch (x) {
                            case 1:
                                return "one";
                            default:
                                break;
                        }
                        String label = switch (x) {
                            case 2 -> "two";
                            default -> "many";
                        };
                        return x > 10 ? label : "small";
                    }
                }
                """));

        // switch statement and switch expression; the conditional expression is not a decision
        assertEquals(3, metrics.cyclomaticComplexity());
    }

    @Test
    void testExpressionStatements() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    void g() {
                        System.out.println("x");
                        int a = 1;
                        a = 2;
                        a += 3;
                        a++;
                        new StringBuilder();
                    }
                }
                """));

        // println and new StringBuilder(); declarations, assignments and increments do not count
        assertEquals(2, metrics.expressionStatements());
        // own header, one declaration, two assignments, one increment
        assertEquals(5, metrics.statements());
    }

    @Test
    void testIncrementsAreStatementsNotExpressionStatements() {
        Metrics postfix = extractor.extract(method("""
                class A {
                    void g(int a) {
                        a++;
                    }
                }
                """));
        Metrics compound = extractor.extract(method("""
                class A {
                    void g(int a) {
                        a += 1;
                    }
                }
                """));
        Metrics negation = extractor.extract(method("""
                class A {
                    int g(int a) {
                        return -a;
                    }
                }
                """));

        assertEquals(compound.statements(), postfix.statements());
        assertEquals(compound.expressionStatements(), postfix.expressionStatements());
        assertEquals(0, postfix.expressionStatements());
        // header and return; unary minus is not an increment
        assertEquals(2, negation.statements());
    }

    @Test
    void testSynchronizedBlockIsStatementAndDecision() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    private final Object lock = new Object();

                    void g() {
                        synchronized (lock) {
                            System.out.println("locked");
                        }
                    }
                }
                """));

        assertEquals(2, metrics.cyclomaticComplexity());
        // own header, synchronized
        assertEquals(2, metrics.statements());
        assertEquals(1, metrics.expressionStatements());
    }

    @Test
    void testLambdaBodyCountsTowardEnclosingMethod() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    Runnable g(boolean flag) {
                        return () -> {
                            if (flag) {
                                System.out.println("yes");
                            }
                        };
                    }
                }
                """));

        assertEquals(2, metrics.cyclomaticComplexity());
        assertEquals(1, metrics.expressionStatements());
    }

    @Test
    void testLocalClassCountsTowardEnclosingMethod() {
        Metrics metrics = extractor.extract(method("""
                class A {
                    void g() {
                        class Local {
                            int h(int y) {
                                while (y > 0) {
                                    y--;
                                }
                                return y;
                            }
                        }
                    }
                }
                """));

        assertEquals(2, metrics.cyclomaticComplexity());
        // g header, Local header, h header, while, y--, return
        assertEquals(6, metrics.statements());
    }

    @Test
    void testVarargsAreNotCountedAsParameters() {
        MethodDeclaration declaration = method("""
                class A {
                    void log(String format, int level, Object... args) {
                    }
                }
                """);

        assertEquals(2, extractor.extract(declaration).parameters());
    }

    @Test
    void testConstructor() {
        CallableDeclaration<?> constructor = parse("""
                class A {
                    private final int x;

                    A(int x) {
                        if (x < 0) {
                            throw new IllegalArgumentException();
                        }
                        this.x = x;
                    }
                }
                """).findFirst(ConstructorDeclaration.class).orElseThrow();

        Metrics metrics = extractor.extract(constructor);

        assertEquals(2, metrics.cyclomaticComplexity());
        // header, if, throw, assignment
        assertEquals(4, metrics.statements());
        assertEquals(1, metrics.parameters());
        assertEquals(6, metrics.lines());
    }

    @Test
    void testAnnotationsAreExpressions() {
        Metrics plain = extractor.extract(method("""
                class A {
                    public String toString() {
                        return "A";
                    }
                }
                """));
        Metrics annotated = extractor.extract(method("""
                class A {
                    @Override
                    public String toString() {
                        return "A";
                    }
                }
                """));

        assertEquals(plain.expressions() + 1, annotated.expressions());
    }
}
