package ftcdsl.print;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class EmissionBufferTest {
	@Test
	void indentsNestedBlocksByFourSpaces() {
		EmissionBuffer out = new EmissionBuffer();
		out.open("class A");
		out.open("void f()");
		out.line("x = 1;");
		out.close();
		out.blank();
		out.close();

		assertEquals("class A {\n    void f() {\n        x = 1;\n    }\n\n}\n", out.finish());
	}

	@Test
	void reopensAtTheOuterLevel() {
		EmissionBuffer out = new EmissionBuffer();
		out.open("if (a)");
		out.line("f();");
		out.reopen("else if (b)");
		out.line("g();");
		out.reopen("else");
		out.close();

		assertEquals("if (a) {\n    f();\n} else if (b) {\n    g();\n} else {\n}\n", out.finish());
		assertEquals(0, out.depth());
	}

	@Test
	void rejectsUnbalancedBlocks() {
		EmissionBuffer open = new EmissionBuffer();
		open.open("class A");
		assertEquals(1, open.depth());
		assertThrows(IllegalStateException.class, open::finish);

		EmissionBuffer closed = new EmissionBuffer();
		assertThrows(IllegalStateException.class, closed::close);
		assertThrows(IllegalStateException.class, () -> closed.reopen("else"));
	}
}
