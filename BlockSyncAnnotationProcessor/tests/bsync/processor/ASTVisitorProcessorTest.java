package bsync.processor;

import static com.google.common.truth.Truth.assertThat;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.google.common.collect.ImmutableList;

public class ASTVisitorProcessorTest {
  @TempDir Path dir;

  private Path sources;
  private Path generated;
  private Path classes;

  @BeforeEach
  public void setUp() throws IOException {
    sources = Files.createDirectories(dir.resolve("src/bsync"));
    generated = Files.createDirectories(dir.resolve("generated"));
    classes = Files.createDirectories(dir.resolve("classes"));

    writeSource(
        "ASTNodeInterface",
        "public interface ASTNodeInterface {",
        "  <V> V accept(ASTVisitor<V> visitor, V value);",
        "  <V> V visitChildren(ASTVisitor<V> visitor, V value);",
        "}");
    writeSource(
        "ASTNodeUtils",
        "public final class ASTNodeUtils {",
        "  public static <V> V accept(",
        "      Iterable<? extends ASTNodeInterface> obj, ASTVisitor<V> visitor, V value) {",
        "    for (ASTNodeInterface o : obj) {",
        "      value = o.accept(visitor, value);",
        "    }",
        "    return value;",
        "  }",
        "}");
    writeSource(
        "Shape",
        "import bsync.processor.ASTChild;",
        "import bsync.processor.ASTNode;",
        "import java.util.ArrayList;",
        "import java.util.List;",
        "public abstract class Shape implements ASTNodeInterface {",
        "  @ASTNode",
        "  public static final class Dot extends Shape implements Shape_Dot_ASTNode {}",
        "  @ASTNode",
        "  public static final class Group extends Shape implements Shape_Group_ASTNode {",
        "    private final List<Shape> members = new ArrayList<>();",
        "    @ASTChild",
        "    @Override",
        "    public List<Shape> members() {",
        "      return members;",
        "    }",
        "  }",
        "}");
    writeSource(
        "DotCounter",
        "public final class DotCounter extends DefaultASTVisitor<Integer> {",
        "  @Override",
        "  public Integer visit(Shape.Dot node, Integer value) {",
        "    return value + 1;",
        "  }",
        "  public static int countSample() {",
        "    Shape.Group inner = new Shape.Group();",
        "    inner.members().add(new Shape.Dot());",
        "    inner.members().add(new Shape.Dot());",
        "    Shape.Group outer = new Shape.Group();",
        "    outer.members().add(new Shape.Dot());",
        "    outer.members().add(inner);",
        "    return outer.accept(new DotCounter(), 0);",
        "  }",
        "}");
  }

  private void writeSource(String className, String... lines) throws IOException {
    String text = "package bsync;\n\n" + String.join("\n", lines) + "\n";
    Files.write(sources.resolve(className + ".java"), text.getBytes(StandardCharsets.UTF_8));
  }

  private List<Diagnostic<? extends JavaFileObject>> compile() throws Exception {
    JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
    DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
    String annotations =
        Paths.get(ASTNode.class.getProtectionDomain().getCodeSource().getLocation().toURI())
            .toString();

    try (StandardJavaFileManager files =
        compiler.getStandardFileManager(diagnostics, null, StandardCharsets.UTF_8)) {
      List<File> inputs;
      try (Stream<Path> paths = Files.list(sources)) {
        inputs = paths.map(Path::toFile).collect(Collectors.toList());
      }
      JavaCompiler.CompilationTask task =
          compiler.getTask(
              null,
              files,
              diagnostics,
              ImmutableList.of(
                  "-classpath", annotations,
                  "-d", classes.toString(),
                  "-s", generated.toString()),
              null,
              files.getJavaFileObjectsFromFiles(inputs));
      task.setProcessors(ImmutableList.of(new ASTVisitorProcessor()));
      task.call();
    }
    return diagnostics.getDiagnostics();
  }

  private static ImmutableList<String> messages(
      List<Diagnostic<? extends JavaFileObject>> diagnostics, Diagnostic.Kind kind) {
    return diagnostics.stream()
        .filter(d -> d.getKind() == kind)
        .map(d -> d.getMessage(null))
        .collect(ImmutableList.toImmutableList());
  }

  @Test
  public void cleanBuildCompilesVisitorSubclasses() throws Exception {
    List<Diagnostic<? extends JavaFileObject>> diagnostics = compile();

    assertThat(messages(diagnostics, Diagnostic.Kind.ERROR)).isEmpty();
    for (Diagnostic<? extends JavaFileObject> diagnostic : diagnostics) {
      assertThat(diagnostic.getMessage(null)).doesNotContain("last round");
    }
    assertThat(Files.exists(generated.resolve("bsync/ASTVisitor.java"))).isTrue();
    assertThat(Files.exists(generated.resolve("bsync/DefaultASTVisitor.java"))).isTrue();
    assertThat(Files.exists(generated.resolve("bsync/VoidDefaultASTVisitor.java"))).isTrue();
    assertThat(Files.exists(generated.resolve("bsync/Shape_Group_ASTNode.java"))).isTrue();
  }

  @Test
  public void generatedVisitorWalksChildren() throws Exception {
    assertThat(messages(compile(), Diagnostic.Kind.ERROR)).isEmpty();

    try (URLClassLoader loader =
        new URLClassLoader(
            new URL[] {classes.toUri().toURL()}, ASTVisitorProcessorTest.class.getClassLoader())) {
      Object count = loader.loadClass("bsync.DotCounter").getMethod("countSample").invoke(null);
      assertThat(count).isEqualTo(3);
    }
  }

  @Test
  public void visitorListsEveryNodeType() throws Exception {
    compile();

    String visitor =
        new String(
            Files.readAllBytes(generated.resolve("bsync/ASTVisitor.java")), StandardCharsets.UTF_8);
    assertThat(visitor).contains("V visit(bsync.Shape.Dot node, V value);");
    assertThat(visitor).contains("V visit(bsync.Shape.Group node, V value);");
  }
}
