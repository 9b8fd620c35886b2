package com.chih.JTemplates.core.impl;

import com.chih.JTemplates.core.exception.TemplateRenderException;
import com.chih.JTemplates.core.spi.CompiledTemplate;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.io.Writer;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MustacheTemplateEngineTest {

    private final MustacheTemplateEngine engine = new MustacheTemplateEngine();

    private String render(CompiledTemplate compiled, Object scope) {
        StringWriter writer = new StringWriter();
        engine.render("test", compiled.getEngineObject(), scope, writer);
        return writer.toString();
    }

    @Test
    void testSimpleRender() {
        CompiledTemplate compiled = engine.compile("Hello {{name}}", "test-simple.html", null);

        assertThat(render(compiled, Map.of("name", "World"))).isEqualTo("Hello World");
    }

    @Test
    void testComplexObjectRender() {
        String template = "User: {{user.name}}, Age: {{user.age}}";
        Map<String, Object> user = Map.of("name", "Gemini", "age", 1);

        CompiledTemplate compiled = engine.compile(template, "test-complex.html", null);

        assertThat(render(compiled, Map.of("user", user))).isEqualTo("User: Gemini, Age: 1");
    }

    @Test
    void testLogicRender() {
        CompiledTemplate compiled = engine.compile(
                "{{#isAdmin}}Admin{{/isAdmin}}{{^isAdmin}}User{{/isAdmin}}", "test-logic.html", null);

        assertThat(render(compiled, Map.of("isAdmin", true))).isEqualTo("Admin");
        assertThat(render(compiled, Map.of("isAdmin", false))).isEqualTo("User");
    }

    @Test
    void testRenderWithNullScope() {
        CompiledTemplate compiled = engine.compile("A()", "a.html", null);

        assertThat(render(compiled, null)).isEqualTo("A()");
    }

    @Test
    void testRenderError() {
        // null 编译对象什么都不输出
        StringWriter writer = new StringWriter();
        engine.render("nothing", null, null, writer);
        assertThat(writer.toString()).isEmpty();

        // Mustache 不完整的循环语法会导致编译异常
        assertThrows(RuntimeException.class, () -> engine.compile("{{#incomplete}}", "test-error.html", null));
    }

    @Test
    void testRenderFailureIsWrapped() {
        CompiledTemplate compiled = engine.compile("Hello {{name}}", "broken-writer.html", null);
        Writer failing = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) {
                throw new IllegalStateException("disk full");
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        };

        assertThatThrownBy(() -> engine.render("broken-writer.html", compiled.getEngineObject(),
                Map.of("name", "World"), failing))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessageContaining("broken-writer.html");
    }

    @Test
    void testCompileWithNullTemplate() {
        assertThat(engine.compile(null, "test-null.html", null)).isNull();
    }

    @Test
    void testCompileWithPartialLoader() {
        CompiledTemplate compiled = engine.compile("A({{> s/b.html}})", "a.html", name -> {
            if ("s/b.html".equals(name)) {
                return "B()";
            }
            return null;
        });

        assertThat(render(compiled, null)).isEqualTo("A(B())");
        // 验证依赖被正确记录
        assertThat(compiled.getDependencies()).containsExactly("s/b.html");
    }

    @Test
    void testPartialNamesAreRelativeToRoot() {
        // 子目录中的模板引用其他模板时，仍然按根目录解析
        Map<String, String> sources = Map.of(
                "s/b.html", "B({{> c.html}})",
                "c.html", "C",
                "s/c.html", "wrong");

        CompiledTemplate compiled = engine.compile(sources.get("s/b.html"), "s/b.html", sources::get);

        assertThat(render(compiled, null)).isEqualTo("B(C)");
        assertThat(compiled.getDependencies()).containsExactly("c.html");
    }

    @Test
    void testLeadingSlashInPartialName() {
        CompiledTemplate compiled = engine.compile("A({{> /s/b.html}})", "a.html",
                name -> "s/b.html".equals(name) ? "B()" : null);

        assertThat(render(compiled, null)).isEqualTo("A(B())");
    }

    @Test
    void testTransitiveDependencies() {
        Map<String, String> sources = Map.of(
                "a.html", "A({{> b.html}})",
                "b.html", "B({{> c.html}})",
                "c.html", "C");

        CompiledTemplate compiled = engine.compile(sources.get("a.html"), "a.html", sources::get);

        assertThat(render(compiled, null)).isEqualTo("A(B(C))");
        assertThat(compiled.getDependencies()).containsExactlyInAnyOrder("b.html", "c.html");
    }

    @Test
    void testMissingPartialFailsAtCompileTime() {
        assertThrows(RuntimeException.class,
                () -> engine.compile("A({{> missing.html}})", "a.html", name -> null));
        assertThrows(RuntimeException.class,
                () -> engine.compile("A({{> missing.html}})", "a.html", null));
    }
}
